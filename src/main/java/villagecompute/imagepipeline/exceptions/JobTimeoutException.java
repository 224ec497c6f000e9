/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

import java.time.Duration;

/**
 * Exception describing a job that exceeded its execution budget. The job is forced into {@code FAILED} and its worker
 * slot is reclaimed.
 */
public class JobTimeoutException extends RuntimeException {

    public JobTimeoutException(String jobId, Duration budget) {
        super("Job " + jobId + " exceeded execution budget of " + budget.toMillis() + "ms");
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

/**
 * Failure categories recorded on a failed job.
 */
public enum JobErrorCode {
    /** Corrupt source, unsupported conversion, storage failure or resource exhaustion. */
    EXECUTION_ERROR,
    /** Job exceeded the configured execution budget. */
    TIMEOUT,
    /** Spec could not be applied to the decoded source. */
    VALIDATION_ERROR
}

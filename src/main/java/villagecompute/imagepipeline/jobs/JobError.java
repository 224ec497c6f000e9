/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

/**
 * Failure detail of a {@link JobState#FAILED} job.
 */
public record JobError(JobErrorCode code, String message) {
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import villagecompute.imagepipeline.data.models.Fingerprint;

/**
 * Reference to a submitted job.
 *
 * @param jobId
 *            job identifier
 * @param fingerprint
 *            fingerprint the job produces
 * @param attached
 *            true when the submit joined an already running job for the same fingerprint
 */
public record JobHandle(String jobId, Fingerprint fingerprint, boolean attached) {
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import java.time.Instant;

import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;

/**
 * Immutable view of a job at one point in time.
 *
 * <p>
 * {@code artifact} is set only for {@link JobState#SUCCEEDED}; {@code error} only for {@link JobState#FAILED}.
 */
public record JobStatusSnapshot(String jobId, String imageId, Fingerprint fingerprint, JobState state,
        Artifact artifact, JobError error, Instant enqueuedAt, Instant startedAt, Instant finishedAt) {

    public boolean isTerminal() {
        return state.isTerminal();
    }
}

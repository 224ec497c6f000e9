/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data.models;

import java.time.Instant;

import villagecompute.imagepipeline.jobs.JobState;

/**
 * Persisted view of a transformation job, written on every state transition.
 */
public record JobRecord(String id, String imageId, String fingerprint, String requesterId, JobState state,
        String errorCode, String errorMessage, Instant createdAt, Instant updatedAt) {
}

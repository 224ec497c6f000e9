/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.imagepipeline.jobs.JobStatusSnapshot;

/**
 * Job status payload. Failed and timed out jobs are reported here, not as HTTP errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusType(@JsonProperty("job_id") String jobId, @JsonProperty("image_id") String imageId,
        @JsonProperty("fingerprint") String fingerprint, @JsonProperty("state") String state,
        @JsonProperty("artifact") ArtifactType artifact, @JsonProperty("error") ErrorType error,
        @JsonProperty("enqueued_at") Instant enqueuedAt, @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt) {

    /**
     * Failure detail.
     *
     * @param code
     *            EXECUTION_ERROR, TIMEOUT or VALIDATION_ERROR
     * @param message
     *            human readable cause
     */
    public record ErrorType(@JsonProperty("code") String code, @JsonProperty("message") String message) {
    }

    public static JobStatusType fromSnapshot(JobStatusSnapshot snapshot, String artifactUrl) {
        ArtifactType artifact = snapshot.artifact() == null
                ? null
                : ArtifactType.fromArtifact(snapshot.artifact(), artifactUrl);
        ErrorType error = snapshot.error() == null
                ? null
                : new ErrorType(snapshot.error().code().name(), snapshot.error().message());
        return new JobStatusType(snapshot.jobId(), snapshot.imageId(), snapshot.fingerprint().value(),
                snapshot.state().wireName(), artifact, error, snapshot.enqueuedAt(), snapshot.startedAt(),
                snapshot.finishedAt());
    }
}

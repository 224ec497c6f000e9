/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.jobs.JobHandle;

/**
 * Outcome of a delivery request: exactly one of {@code artifact}, {@code original} or {@code job} is set, matching
 * {@code kind}.
 *
 * @param kind
 *            which reference is present
 * @param image
 *            source image the request was resolved against
 * @param fingerprint
 *            fingerprint of the requested result, null for {@link Kind#ORIGINAL}
 * @param artifact
 *            cached artifact for {@link Kind#READY}
 * @param job
 *            handle to poll for {@link Kind#PENDING}
 * @param rateLimitRemaining
 *            tokens left in the bucket charged for this request
 */
public record DeliveryResult(Kind kind, ImageRecord image, Fingerprint fingerprint, Artifact artifact, JobHandle job,
        long rateLimitRemaining) {

    public enum Kind {
        /** Transformed artifact served from cache. */
        READY,
        /** No transformation requested, the original image is the result. */
        ORIGINAL,
        /** Artifact is being produced by a job. */
        PENDING
    }

    static DeliveryResult ready(ImageRecord image, Artifact artifact, long remaining) {
        return new DeliveryResult(Kind.READY, image, artifact.fingerprint(), artifact, null, remaining);
    }

    static DeliveryResult original(ImageRecord image, long remaining) {
        return new DeliveryResult(Kind.ORIGINAL, image, null, null, null, remaining);
    }

    static DeliveryResult pending(ImageRecord image, JobHandle job, long remaining) {
        return new DeliveryResult(Kind.PENDING, image, job.fingerprint(), null, job, remaining);
    }
}

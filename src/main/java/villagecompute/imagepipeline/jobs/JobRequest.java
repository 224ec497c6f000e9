/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import java.util.Objects;

import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformSpec;

/**
 * Everything a worker needs to produce one artifact.
 *
 * @param source
 *            source image metadata
 * @param spec
 *            validated spec
 * @param format
 *            effective output format
 * @param requesterId
 *            user that first submitted the job
 * @param fingerprint
 *            fingerprint of the result
 */
public record JobRequest(ImageRecord source, TransformSpec spec, OutputFormat format, String requesterId,
        Fingerprint fingerprint) {

    public JobRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }
}

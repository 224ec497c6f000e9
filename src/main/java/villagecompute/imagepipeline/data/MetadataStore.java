/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data;

import java.util.Optional;

import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.data.models.JobRecord;

/**
 * Persistence for image and job metadata. Implementations must be safe for concurrent use.
 */
public interface MetadataStore {

    void saveImage(ImageRecord image);

    Optional<ImageRecord> findImage(String imageId);

    /**
     * @return true if a record was removed
     */
    boolean deleteImage(String imageId);

    void saveJob(JobRecord job);

    Optional<JobRecord> findJob(String jobId);

    boolean deleteJob(String jobId);
}

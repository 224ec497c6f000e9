/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.data.models.JobRecord;

/**
 * Process-local {@link MetadataStore} backed by concurrent maps. Contents do not survive a restart.
 */
@ApplicationScoped
public class InMemoryMetadataStore implements MetadataStore {

    private static final Logger LOG = Logger.getLogger(InMemoryMetadataStore.class);

    private final ConcurrentMap<String, ImageRecord> images = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, JobRecord> jobs = new ConcurrentHashMap<>();

    @Override
    public void saveImage(ImageRecord image) {
        Objects.requireNonNull(image, "image");
        images.put(image.id(), image);
        LOG.debugf("Saved image %s (owner=%s, %dx%d)", image.id(), image.ownerId(), image.width(), image.height());
    }

    @Override
    public Optional<ImageRecord> findImage(String imageId) {
        if (imageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(images.get(imageId));
    }

    @Override
    public boolean deleteImage(String imageId) {
        return imageId != null && images.remove(imageId) != null;
    }

    @Override
    public void saveJob(JobRecord job) {
        Objects.requireNonNull(job, "job");
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<JobRecord> findJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public boolean deleteJob(String jobId) {
        return jobId != null && jobs.remove(jobId) != null;
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.data.MetadataStore;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.exceptions.CacheUnavailableException;
import villagecompute.imagepipeline.exceptions.ResourceNotFoundException;
import villagecompute.imagepipeline.exceptions.TransformExecutionException;
import villagecompute.imagepipeline.exceptions.ValidationException;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.services.AdmissionControlService.ActionClass;
import villagecompute.imagepipeline.transform.ImageCodec;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformExecutor;

/**
 * Registry of source images.
 *
 * <p>
 * Originals are stored under {@code originals/<imageId>} and described by an {@link ImageRecord} holding the SHA-256
 * content hash and the detected dimensions and MIME type. Records are immutable; deleting an image drops its record, its
 * stored original and every cached artifact derived from its content.
 */
@ApplicationScoped
public class ImageCatalogService {

    private static final Logger LOG = Logger.getLogger(ImageCatalogService.class);

    static final String ORIGINAL_PREFIX = "originals/";

    @Inject
    BlobStore blobStore;

    @Inject
    MetadataStore metadataStore;

    @Inject
    FingerprintService fingerprintService;

    @Inject
    ArtifactCacheService cacheService;

    @Inject
    AdmissionControlService admissionControl;

    @Inject
    TransformExecutor transformExecutor;

    Clock clock = Clock.systemUTC();

    /**
     * Stores and registers a new original for the calling user.
     *
     * @param identity
     *            authenticated uploader
     * @param bytes
     *            encoded image
     * @return the registered image
     * @throws ValidationException
     *             if the bytes are empty, not a readable image, or larger than the pixel budget
     */
    public ImageRecord upload(RequestIdentity identity, byte[] bytes) {
        identity.requireAuthenticated();
        LoggingConfig.setUserId(identity.userId());
        admissionControl.enforce(identity, ActionClass.UPLOAD);

        if (bytes == null || bytes.length == 0) {
            throw new ValidationException("Image body is empty");
        }
        ImageCodec.ImageInfo info = readInfo(bytes);
        checkPixelBudget(info);

        String imageId = UUID.randomUUID().toString();
        String objectKey = ORIGINAL_PREFIX + imageId;
        blobStore.upload(objectKey, bytes, info.mimeType());

        return save(imageId, identity.userId(), objectKey, bytes, info);
    }

    /**
     * Registers an original that is already present in blob storage.
     *
     * @param ownerId
     *            owning user
     * @param objectKey
     *            key of the stored original
     * @return the registered image
     */
    public ImageRecord register(String ownerId, String objectKey) {
        byte[] bytes = blobStore.download(objectKey);
        ImageCodec.ImageInfo info = readInfo(bytes);
        checkPixelBudget(info);
        return save(UUID.randomUUID().toString(), ownerId, objectKey, bytes, info);
    }

    /**
     * @throws ResourceNotFoundException
     *             if no image has the id
     */
    public ImageRecord get(String imageId) {
        return metadataStore.findImage(imageId)
                .orElseThrow(() -> new ResourceNotFoundException("Image not found: " + imageId));
    }

    /**
     * Deletes an image owned by the caller, its stored original and its cached derivatives.
     */
    public void delete(String imageId, RequestIdentity identity) {
        identity.requireAuthenticated();
        ImageRecord image = get(imageId);
        identity.requireOwnerOf(image);

        metadataStore.deleteImage(imageId);
        blobStore.delete(image.storageKey());

        int invalidated = 0;
        try {
            invalidated = cacheService.invalidateSource(image.contentHash());
        } catch (CacheUnavailableException e) {
            LOG.debugf("Skipped artifact invalidation for image %s: %s", imageId, e.getMessage());
        }
        LOG.infof("Deleted image %s (owner=%s, %d cached artifacts dropped)", imageId, image.ownerId(), invalidated);
    }

    /**
     * Output format used when a request names none: the source's own encoding if it can be written, PNG otherwise.
     */
    public OutputFormat defaultFormat(ImageRecord image) {
        return OutputFormat.fromMimeType(image.mimeType()).orElse(OutputFormat.PNG);
    }

    private ImageRecord save(String imageId, String ownerId, String objectKey, byte[] bytes,
            ImageCodec.ImageInfo info) {
        ImageRecord image = new ImageRecord(imageId, ownerId, fingerprintService.contentHash(bytes), objectKey,
                info.mimeType(), info.width(), info.height(), bytes.length, Instant.now(clock));
        metadataStore.saveImage(image);
        LOG.infof("Registered image %s (owner=%s, %dx%d %s, %d bytes)", imageId, ownerId, info.width(),
                info.height(), info.mimeType(), bytes.length);
        return image;
    }

    private void checkPixelBudget(ImageCodec.ImageInfo info) {
        long maxPixels = transformExecutor.getMaxPixels();
        if ((long) info.width() * info.height() > maxPixels) {
            throw new ValidationException("Image " + info.width() + "x" + info.height()
                    + " exceeds the pixel budget of " + maxPixels);
        }
    }

    private static ImageCodec.ImageInfo readInfo(byte[] bytes) {
        try {
            return ImageCodec.readInfo(bytes);
        } catch (TransformExecutionException e) {
            throw new ValidationException("Unsupported or corrupt image: " + e.getMessage(), e);
        }
    }
}

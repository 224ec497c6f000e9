/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data.models;

import java.time.Instant;

/**
 * Metadata of an uploaded source image. Source images are immutable: replacing content means registering a new image
 * with a new id and content hash.
 *
 * @param id
 *            image identifier
 * @param ownerId
 *            user that uploaded the image
 * @param contentHash
 *            lowercase hex SHA-256 of the stored bytes
 * @param storageKey
 *            object key of the original in blob storage
 * @param mimeType
 *            detected MIME type of the original
 * @param width
 *            pixel width
 * @param height
 *            pixel height
 * @param sizeBytes
 *            stored size
 * @param createdAt
 *            registration time
 */
public record ImageRecord(String id, String ownerId, String contentHash, String storageKey, String mimeType, int width,
        int height, long sizeBytes, Instant createdAt) {

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}

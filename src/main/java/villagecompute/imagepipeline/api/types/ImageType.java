/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.imagepipeline.data.models.ImageRecord;

/**
 * Source image metadata.
 */
public record ImageType(@JsonProperty("image_id") String imageId, @JsonProperty("owner_id") String ownerId,
        @JsonProperty("content_hash") String contentHash, @JsonProperty("mime_type") String mimeType,
        @JsonProperty("width") int width, @JsonProperty("height") int height,
        @JsonProperty("size_bytes") long sizeBytes, @JsonProperty("created_at") Instant createdAt) {

    public static ImageType fromRecord(ImageRecord image) {
        return new ImageType(image.id(), image.ownerId(), image.contentHash(), image.mimeType(), image.width(),
                image.height(), image.sizeBytes(), image.createdAt());
    }
}

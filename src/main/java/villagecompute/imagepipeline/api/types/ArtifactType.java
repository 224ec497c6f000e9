/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.imagepipeline.data.models.Artifact;

/**
 * Reference to a produced artifact. Bytes are fetched from {@code url} (signed, time limited) or from the image
 * content endpoint.
 *
 * @param fingerprint
 *            content address
 * @param format
 *            output format name
 * @param mimeType
 *            MIME type of the bytes
 * @param width
 *            pixel width
 * @param height
 *            pixel height
 * @param sizeBytes
 *            encoded size
 * @param createdAt
 *            production time
 * @param url
 *            signed download URL, absent when the artifact was not persisted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactType(@JsonProperty("fingerprint") String fingerprint, @JsonProperty("format") String format,
        @JsonProperty("mime_type") String mimeType, @JsonProperty("width") int width,
        @JsonProperty("height") int height, @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("created_at") Instant createdAt, @JsonProperty("url") String url) {

    public static ArtifactType fromArtifact(Artifact artifact, String url) {
        return new ArtifactType(artifact.fingerprint().value(), artifact.format().canonicalName(), artifact.mimeType(),
                artifact.width(), artifact.height(), artifact.sizeBytes(), artifact.createdAt(), url);
    }
}

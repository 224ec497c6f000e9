/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pre-signed URL for temporary direct access to a stored object.
 *
 * @param url
 *            signed URL
 * @param expiresAt
 *            ISO-8601 expiry timestamp
 * @param ttlMinutes
 *            validity in minutes
 * @param objectKey
 *            object the URL grants access to
 */
public record SignedUrlType(String url, @JsonProperty("expires_at") String expiresAt,
        @JsonProperty("ttl_minutes") int ttlMinutes, @JsonProperty("object_key") String objectKey) {
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the image and transform endpoints.
 *
 * <ul>
 * <li>{@code ready}: {@code artifact} holds the cached result (HTTP 200)</li>
 * <li>{@code original}: {@code image} is the result, no transformation was requested (HTTP 200)</li>
 * <li>{@code pending}: poll {@code job_id} for the result (HTTP 202)</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryType(@JsonProperty("status") String status, @JsonProperty("image") ImageType image,
        @JsonProperty("fingerprint") String fingerprint, @JsonProperty("artifact") ArtifactType artifact,
        @JsonProperty("job_id") String jobId, @JsonProperty("original_url") String originalUrl) {
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for {@code POST /api/images/{imageId}/transforms}.
 *
 * <pre>
 * {"operations": [{"op": "resize", "width": 400}, {"op": "grayscale"}], "format": "png"}
 * </pre>
 *
 * @param operations
 *            ordered operations, each an object with an {@code op} key plus its parameters
 * @param format
 *            output format (jpeg, png, gif, bmp, webp); omitted to keep the source format
 */
public record TransformRequestType(@NotNull @JsonProperty("operations") List<Map<String, Object>> operations,
        @JsonProperty("format") String format) {
}

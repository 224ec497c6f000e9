/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.util.Locale;
import java.util.Set;

import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * Closed set of pixel operations the executor understands, with their wire names and the parameter keys each accepts.
 *
 * <p>
 * Every {@link TransformOperation} variant reports exactly one kind. The executor dispatches through an exhaustive
 * {@code switch} over this enum, so adding a kind without handling it fails compilation.
 */
public enum OperationKind {

    RESIZE("resize", Set.of("width", "height")),
    CROP("crop", Set.of("x", "y", "width", "height")),
    ROTATE("rotate", Set.of("degrees")),
    FLIP("flip", Set.of("axis")),
    WATERMARK("watermark", Set.of("overlay", "position", "opacity")),
    FORMAT("format", Set.of("target")),
    GRAYSCALE("grayscale", Set.of()),
    SEPIA("sepia", Set.of()),
    MIRROR("mirror", Set.of()),
    COMPRESS("compress", Set.of("quality"));

    private final String wireName;
    private final Set<String> parameterKeys;

    OperationKind(String wireName, Set<String> parameterKeys) {
        this.wireName = wireName;
        this.parameterKeys = parameterKeys;
    }

    public String wireName() {
        return wireName;
    }

    public Set<String> parameterKeys() {
        return parameterKeys;
    }

    /**
     * Resolves an operation kind from its wire name (case-insensitive).
     *
     * @throws ValidationException
     *             if the name does not match a supported operation
     */
    public static OperationKind fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Operation name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (OperationKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new ValidationException("Unsupported operation: " + name);
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.util.Locale;
import java.util.Optional;

import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * Encodings the pipeline can produce. Each maps to an ImageIO writer found by MIME type; WebP comes from the
 * webp-imageio plugin.
 */
public enum OutputFormat {

    JPEG("image/jpeg", "jpg", true, false),
    PNG("image/png", "png", false, true),
    GIF("image/gif", "gif", false, true),
    BMP("image/bmp", "bmp", false, false),
    WEBP("image/webp", "webp", true, true);

    private final String mimeType;
    private final String extension;
    private final boolean lossy;
    private final boolean supportsAlpha;

    OutputFormat(String mimeType, String extension, boolean lossy, boolean supportsAlpha) {
        this.mimeType = mimeType;
        this.extension = extension;
        this.lossy = lossy;
        this.supportsAlpha = supportsAlpha;
    }

    public String mimeType() {
        return mimeType;
    }

    public String extension() {
        return extension;
    }

    public boolean isLossy() {
        return lossy;
    }

    public boolean supportsAlpha() {
        return supportsAlpha;
    }

    /**
     * Canonical lower-case name used in fingerprints and API payloads.
     */
    public String canonicalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a user supplied format name ("jpg", "jpeg", "png", ...).
     *
     * @throws ValidationException
     *             if the target encoding is not supported
     */
    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Output format is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("image/")) {
            return fromMimeType(normalized)
                    .orElseThrow(() -> new ValidationException("Unsupported output format: " + name));
        }
        return switch (normalized) {
            case "jpg", "jpeg" -> JPEG;
            case "png" -> PNG;
            case "gif" -> GIF;
            case "bmp" -> BMP;
            case "webp" -> WEBP;
            default -> throw new ValidationException("Unsupported output format: " + name);
        };
    }

    /**
     * Maps a MIME type reported by the upload collaborator to a format, if the pipeline can write it.
     */
    public static Optional<OutputFormat> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.mimeType.equals(normalized)) {
                return Optional.of(format);
            }
        }
        if ("image/jpg".equals(normalized)) {
            return Optional.of(JPEG);
        }
        return Optional.empty();
    }
}

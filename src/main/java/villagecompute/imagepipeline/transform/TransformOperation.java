/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * One step of a {@link TransformSpec}. The set of variants is closed: one record per {@link OperationKind}.
 *
 * <p>
 * Records validate their parameters on construction, so an operation instance is always well formed. Bounds that
 * depend on the image being transformed (crop regions, pixel budget) are checked by {@link #outputDimensions}.
 *
 * <p>
 * {@link #canonical()} produces the encoding used for fingerprints: {@code name(key=value,...)} with keys sorted,
 * integers in plain decimal, decimals without trailing zeros and enum values in lower case.
 */
public sealed interface TransformOperation {

    OperationKind kind();

    /**
     * Parameters in canonical string form, keyed by parameter name. Absent optional parameters are omitted.
     */
    Map<String, String> canonicalParameters();

    /**
     * Computes the dimensions this operation produces for an input of the given size.
     *
     * @throws ValidationException
     *             if the operation cannot be applied to an input of that size
     */
    Dimensions outputDimensions(Dimensions input);

    default String canonical() {
        Map<String, String> sorted = new TreeMap<>(canonicalParameters());
        String params = sorted.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        return kind().wireName() + "(" + params + ")";
    }

    /**
     * Axis a {@link Flip} mirrors about.
     */
    enum FlipAxis {
        HORIZONTAL, VERTICAL;

        public static FlipAxis fromName(String name) {
            if (name == null) {
                throw new ValidationException("flip requires 'axis'");
            }
            return switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "horizontal" -> HORIZONTAL;
                case "vertical" -> VERTICAL;
                default -> throw new ValidationException("flip axis must be horizontal or vertical, got: " + name);
            };
        }
    }

    /**
     * Anchor for a {@link Watermark} overlay.
     */
    enum WatermarkPosition {
        TOP_LEFT, TOP_RIGHT, BOTTOM_LEFT, BOTTOM_RIGHT, CENTER;

        public static WatermarkPosition fromName(String name) {
            if (name == null) {
                throw new ValidationException("watermark requires 'position'");
            }
            String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (WatermarkPosition position : values()) {
                if (position.name().equals(normalized)) {
                    return position;
                }
            }
            throw new ValidationException("Unsupported watermark position: " + name);
        }
    }

    /**
     * Scales the image. With one dimension the other follows the source aspect ratio; with both the result is exact.
     */
    record Resize(Integer width, Integer height) implements TransformOperation {

        public Resize {
            if (width == null && height == null) {
                throw new ValidationException("resize requires 'width' or 'height'");
            }
            if (width != null && width <= 0) {
                throw new ValidationException("resize width must be positive, got: " + width);
            }
            if (height != null && height <= 0) {
                throw new ValidationException("resize height must be positive, got: " + height);
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.RESIZE;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            Map<String, String> params = new TreeMap<>();
            if (width != null) {
                params.put("width", Integer.toString(width));
            }
            if (height != null) {
                params.put("height", Integer.toString(height));
            }
            return params;
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            if (width != null && height != null) {
                return new Dimensions(width, height);
            }
            if (width != null) {
                int scaled = (int) Math.round(input.height() * (width / (double) input.width()));
                return new Dimensions(width, Math.max(1, scaled));
            }
            int scaled = (int) Math.round(input.width() * (height / (double) input.height()));
            return new Dimensions(Math.max(1, scaled), height);
        }
    }

    /**
     * Extracts a rectangular region. Regions that leave the source bounds are rejected, never clamped.
     */
    record Crop(int x, int y, int width, int height) implements TransformOperation {

        public Crop {
            if (x < 0 || y < 0) {
                throw new ValidationException("crop origin must be non-negative, got: " + x + "," + y);
            }
            if (width <= 0 || height <= 0) {
                throw new ValidationException("crop size must be positive, got: " + width + "x" + height);
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CROP;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("x", Integer.toString(x), "y", Integer.toString(y), "width", Integer.toString(width),
                    "height", Integer.toString(height));
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            if ((long) x + width > input.width() || (long) y + height > input.height()) {
                throw new ValidationException("crop region " + width + "x" + height + "+" + x + "+" + y
                        + " exceeds source bounds " + input);
            }
            return new Dimensions(width, height);
        }
    }

    /**
     * Rotates clockwise. Multiples of 90 degrees are exact; other angles grow the canvas and fill the corners with the
     * background color. Degrees are normalized into [0, 360).
     */
    record Rotate(double degrees) implements TransformOperation {

        public Rotate {
            if (Double.isNaN(degrees) || Double.isInfinite(degrees)) {
                throw new ValidationException("rotate degrees must be a finite number");
            }
            degrees = degrees % 360.0;
            if (degrees < 0) {
                degrees += 360.0;
            }
            if (degrees == 0.0) {
                degrees = 0.0;
            }
        }

        public boolean isQuarterTurn() {
            return degrees % 90.0 == 0.0;
        }

        @Override
        public OperationKind kind() {
            return OperationKind.ROTATE;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("degrees", formatDecimal(degrees));
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            if (isQuarterTurn()) {
                return ((int) (degrees / 90.0)) % 2 == 0 ? input : new Dimensions(input.height(), input.width());
            }
            double radians = Math.toRadians(degrees);
            double sin = Math.abs(Math.sin(radians));
            double cos = Math.abs(Math.cos(radians));
            int w = (int) Math.ceil(input.width() * cos + input.height() * sin);
            int h = (int) Math.ceil(input.height() * cos + input.width() * sin);
            return new Dimensions(Math.max(1, w), Math.max(1, h));
        }
    }

    /**
     * Mirrors about the horizontal or vertical axis.
     */
    record Flip(FlipAxis axis) implements TransformOperation {

        public Flip {
            if (axis == null) {
                throw new ValidationException("flip requires 'axis'");
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.FLIP;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("axis", axis.name().toLowerCase(Locale.ROOT));
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    /**
     * Composites another image (referenced by image id) onto the base. Overlays larger than the base are scaled down to
     * fit before compositing.
     */
    record Watermark(String overlay, WatermarkPosition position, double opacity) implements TransformOperation {

        public Watermark {
            if (overlay == null || overlay.isBlank()) {
                throw new ValidationException("watermark requires 'overlay'");
            }
            if (position == null) {
                throw new ValidationException("watermark requires 'position'");
            }
            if (Double.isNaN(opacity) || opacity < 0.0 || opacity > 1.0) {
                throw new ValidationException("watermark opacity must be between 0 and 1, got: " + opacity);
            }
            overlay = overlay.trim();
        }

        @Override
        public OperationKind kind() {
            return OperationKind.WATERMARK;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("overlay", overlay, "position", position.name().toLowerCase(Locale.ROOT), "opacity",
                    formatDecimal(opacity));
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    /**
     * Selects the encoding of the final buffer. The last {@code format} operation in a spec wins over the requested
     * output format.
     */
    record Format(OutputFormat target) implements TransformOperation {

        public Format {
            if (target == null) {
                throw new ValidationException("format requires 'target'");
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.FORMAT;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("target", target.canonicalName());
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    record Grayscale() implements TransformOperation {

        @Override
        public OperationKind kind() {
            return OperationKind.GRAYSCALE;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of();
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    record Sepia() implements TransformOperation {

        @Override
        public OperationKind kind() {
            return OperationKind.SEPIA;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of();
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    /**
     * Left-right mirror image.
     */
    record Mirror() implements TransformOperation {

        @Override
        public OperationKind kind() {
            return OperationKind.MIRROR;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of();
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    /**
     * Lossy re-encode at the given quality (0-100).
     */
    record Compress(int quality) implements TransformOperation {

        public Compress {
            if (quality < 0 || quality > 100) {
                throw new ValidationException("compress quality must be between 0 and 100, got: " + quality);
            }
        }

        @Override
        public OperationKind kind() {
            return OperationKind.COMPRESS;
        }

        @Override
        public Map<String, String> canonicalParameters() {
            return Map.of("quality", Integer.toString(quality));
        }

        @Override
        public Dimensions outputDimensions(Dimensions input) {
            return input;
        }
    }

    /**
     * Formats a decimal in its shortest plain form: no exponent, no trailing zeros, "-0" normalized to "0".
     */
    static String formatDecimal(double value) {
        String plain = new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        return "-0".equals(plain) ? "0" : plain;
    }
}

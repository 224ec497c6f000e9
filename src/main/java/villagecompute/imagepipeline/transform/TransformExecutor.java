/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import villagecompute.imagepipeline.exceptions.TransformExecutionException;
import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * Applies a {@link TransformSpec} to an encoded image.
 *
 * <p>
 * Operations run strictly in spec order, each consuming the buffer produced by the previous one. The executor keeps no
 * state between invocations and never mutates its inputs, so it is safe to call from any number of worker threads.
 *
 * <p>
 * <b>Determinism:</b> identical source bytes, spec and format always produce byte-identical output. Quarter-turn
 * rotations and flips are exact pixel permutations; scaling and arbitrary rotation use fixed Java2D rendering hints;
 * color filters use integer arithmetic.
 *
 * <p>
 * <b>Compression:</b> a {@code compress} operation is a JPEG round trip at its quality, applied in place so later
 * operations see the degraded pixels. When it is the last pixel operation and the output is lossy, it sets the quality
 * of the final encode instead. Every other lossy encode uses {@link ImageCodec#DEFAULT_JPEG_QUALITY}.
 *
 * <p>
 * <b>Interruption:</b> the executor checks the thread's interrupt flag between operations so a timed-out job stops at
 * the next operation boundary.
 */
@Singleton
public class TransformExecutor {

    private static final Logger LOG = Logger.getLogger(TransformExecutor.class);

    private final long maxPixels;
    private final Color background;

    /**
     * Output of a successful execution.
     */
    public record TransformResult(byte[] data, int width, int height, OutputFormat format) {

        public long sizeBytes() {
            return data.length;
        }
    }

    @Inject
    public TransformExecutor(@ConfigProperty(
            name = "imagepipeline.transform.max-pixels",
            defaultValue = "40000000") long maxPixels,
            @ConfigProperty(
                    name = "imagepipeline.transform.background",
                    defaultValue = "#FFFFFF") String background) {
        this(maxPixels, Color.decode(background));
    }

    public TransformExecutor(long maxPixels, Color background) {
        this.maxPixels = maxPixels;
        this.background = background;
    }

    public long getMaxPixels() {
        return maxPixels;
    }

    /**
     * Runs the spec against the source.
     *
     * @param source
     *            encoded source image, treated as read-only
     * @param spec
     *            operations to apply
     * @param requestedFormat
     *            output encoding unless a {@code format} operation overrides it
     * @param overlays
     *            encoded overlay images keyed by the reference used in watermark operations
     * @return encoded result with derived metadata
     * @throws ValidationException
     *             if the spec does not fit the decoded source
     * @throws TransformExecutionException
     *             if decoding, processing or encoding fails
     */
    public TransformResult execute(byte[] source, TransformSpec spec, OutputFormat requestedFormat,
            Map<String, byte[]> overlays) {
        OutputFormat format = spec.effectiveFormat(requestedFormat);
        ImageCodec.ImageInfo info = ImageCodec.readInfo(source);
        spec.plan(new Dimensions(info.width(), info.height()), maxPixels);

        List<TransformOperation> operations = spec.operations();
        int lastPixelOperation = lastPixelOperationIndex(operations);
        int encodeQuality = ImageCodec.DEFAULT_JPEG_QUALITY;
        try {
            BufferedImage image = ImageCodec.decode(source);
            for (int i = 0; i < operations.size(); i++) {
                TransformOperation operation = operations.get(i);
                if (Thread.currentThread().isInterrupted()) {
                    throw new TransformExecutionException("Transformation interrupted before "
                            + operation.kind().wireName());
                }
                if (operation instanceof TransformOperation.Compress compress) {
                    // the final lossy encode is the compression step when nothing follows it
                    if (i == lastPixelOperation && format.isLossy()) {
                        encodeQuality = compress.quality();
                    } else {
                        image = lossyRoundTrip(image, compress.quality());
                    }
                    continue;
                }
                image = apply(operation, image, overlays);
            }
            byte[] encoded = ImageCodec.encode(image, format, encodeQuality, background);
            LOG.debugf("Executed spec [%s] -> %dx%d %s (%d bytes)", spec.canonical(), image.getWidth(),
                    image.getHeight(), format.canonicalName(), encoded.length);
            return new TransformResult(encoded, image.getWidth(), image.getHeight(), format);
        } catch (OutOfMemoryError e) {
            throw new TransformExecutionException("Resource exhaustion while transforming: " + e.getMessage(), e);
        }
    }

    private static int lastPixelOperationIndex(List<TransformOperation> operations) {
        for (int i = operations.size() - 1; i >= 0; i--) {
            if (operations.get(i).kind() != OperationKind.FORMAT) {
                return i;
            }
        }
        return -1;
    }

    private BufferedImage apply(TransformOperation operation, BufferedImage image, Map<String, byte[]> overlays) {
        return switch (operation.kind()) {
            case RESIZE -> resize(image, (TransformOperation.Resize) operation);
            case CROP -> crop(image, (TransformOperation.Crop) operation);
            case ROTATE -> rotate(image, (TransformOperation.Rotate) operation);
            case FLIP -> ((TransformOperation.Flip) operation).axis() == TransformOperation.FlipAxis.HORIZONTAL
                    ? mirrorHorizontally(image)
                    : mirrorVertically(image);
            case WATERMARK -> watermark(image, (TransformOperation.Watermark) operation, overlays);
            case FORMAT, COMPRESS -> image;
            case GRAYSCALE -> grayscale(image);
            case SEPIA -> sepia(image);
            case MIRROR -> mirrorHorizontally(image);
        };
    }

    private BufferedImage resize(BufferedImage image, TransformOperation.Resize resize) {
        Dimensions target = resize.outputDimensions(new Dimensions(image.getWidth(), image.getHeight()));
        return scale(image, target.width(), target.height());
    }

    private BufferedImage scale(BufferedImage image, int width, int height) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scaled.createGraphics();
        try {
            applyQualityHints(g);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private BufferedImage crop(BufferedImage image, TransformOperation.Crop crop) {
        crop.outputDimensions(new Dimensions(image.getWidth(), image.getHeight()));
        BufferedImage region = new BufferedImage(crop.width(), crop.height(), BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[crop.width()];
        for (int y = 0; y < crop.height(); y++) {
            image.getRGB(crop.x(), crop.y() + y, crop.width(), 1, row, 0, crop.width());
            region.setRGB(0, y, crop.width(), 1, row, 0, crop.width());
        }
        return region;
    }

    private BufferedImage rotate(BufferedImage image, TransformOperation.Rotate rotate) {
        double degrees = rotate.degrees();
        if (degrees == 0.0) {
            return image;
        }
        int w = image.getWidth();
        int h = image.getHeight();
        if (rotate.isQuarterTurn()) {
            int turns = (int) (degrees / 90.0);
            BufferedImage rotated = turns == 2
                    ? new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB)
                    : new BufferedImage(h, w, BufferedImage.TYPE_INT_ARGB);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int argb = image.getRGB(x, y);
                    switch (turns) {
                        case 1 -> rotated.setRGB(h - 1 - y, x, argb);
                        case 2 -> rotated.setRGB(w - 1 - x, h - 1 - y, argb);
                        default -> rotated.setRGB(y, w - 1 - x, argb);
                    }
                }
            }
            return rotated;
        }

        Dimensions canvas = rotate.outputDimensions(new Dimensions(w, h));
        BufferedImage rotated = new BufferedImage(canvas.width(), canvas.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = rotated.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, canvas.width(), canvas.height());
            applyQualityHints(g);
            AffineTransform transform = new AffineTransform();
            transform.translate(canvas.width() / 2.0, canvas.height() / 2.0);
            transform.rotate(Math.toRadians(degrees));
            transform.translate(-w / 2.0, -h / 2.0);
            g.drawImage(image, transform, null);
        } finally {
            g.dispose();
        }
        return rotated;
    }

    private BufferedImage mirrorHorizontally(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage mirrored = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                mirrored.setRGB(w - 1 - x, y, image.getRGB(x, y));
            }
        }
        return mirrored;
    }

    private BufferedImage mirrorVertically(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage mirrored = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            mirrored.setRGB(0, h - 1 - y, w, 1, row, 0, w);
        }
        return mirrored;
    }

    private BufferedImage watermark(BufferedImage image, TransformOperation.Watermark watermark,
            Map<String, byte[]> overlays) {
        byte[] overlayBytes = overlays == null ? null : overlays.get(watermark.overlay());
        if (overlayBytes == null) {
            throw new TransformExecutionException("Overlay image not available: " + watermark.overlay());
        }
        BufferedImage overlay = ImageCodec.decode(overlayBytes);
        int baseW = image.getWidth();
        int baseH = image.getHeight();
        if (overlay.getWidth() > baseW || overlay.getHeight() > baseH) {
            double ratio = Math.min(baseW / (double) overlay.getWidth(), baseH / (double) overlay.getHeight());
            int fitW = Math.max(1, (int) Math.floor(overlay.getWidth() * ratio));
            int fitH = Math.max(1, (int) Math.floor(overlay.getHeight() * ratio));
            overlay = scale(overlay, Math.min(fitW, baseW), Math.min(fitH, baseH));
        }

        int x;
        int y;
        switch (watermark.position()) {
            case TOP_LEFT -> {
                x = 0;
                y = 0;
            }
            case TOP_RIGHT -> {
                x = baseW - overlay.getWidth();
                y = 0;
            }
            case BOTTOM_LEFT -> {
                x = 0;
                y = baseH - overlay.getHeight();
            }
            case BOTTOM_RIGHT -> {
                x = baseW - overlay.getWidth();
                y = baseH - overlay.getHeight();
            }
            default -> {
                x = (baseW - overlay.getWidth()) / 2;
                y = (baseH - overlay.getHeight()) / 2;
            }
        }

        BufferedImage composed = new BufferedImage(baseW, baseH, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = composed.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, (float) watermark.opacity()));
            g.drawImage(overlay, x, y, null);
        } finally {
            g.dispose();
        }
        return composed;
    }

    private BufferedImage grayscale(BufferedImage image) {
        return mapPixels(image, (a, r, g, b) -> {
            int gray = (299 * r + 587 * g + 114 * b + 500) / 1000;
            return pack(a, gray, gray, gray);
        });
    }

    private BufferedImage sepia(BufferedImage image) {
        return mapPixels(image, (a, r, g, b) -> {
            int sr = Math.min(255, (393 * r + 769 * g + 189 * b) / 1000);
            int sg = Math.min(255, (349 * r + 686 * g + 168 * b) / 1000);
            int sb = Math.min(255, (272 * r + 534 * g + 131 * b) / 1000);
            return pack(a, sr, sg, sb);
        });
    }

    private BufferedImage lossyRoundTrip(BufferedImage image, int quality) {
        byte[] jpeg = ImageCodec.encode(image, OutputFormat.JPEG, quality, background);
        return ImageCodec.decode(jpeg);
    }

    @FunctionalInterface
    private interface PixelMapper {
        int map(int alpha, int red, int green, int blue);
    }

    private static BufferedImage mapPixels(BufferedImage image, PixelMapper mapper) {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage mapped = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                row[x] = mapper.map((argb >>> 24) & 0xFF, (argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
            }
            mapped.setRGB(0, y, w, 1, row, 0, w);
        }
        return mapped;
    }

    private static int pack(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    private static void applyQualityHints(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import villagecompute.imagepipeline.exceptions.TransformExecutionException;

/**
 * ImageIO based decoding and encoding.
 *
 * <p>
 * Decoded images are normalized to {@code TYPE_INT_ARGB} so every operation works on one pixel layout. Encoding
 * flattens alpha onto a background color for formats that cannot store it. The disk cache of ImageIO is disabled so
 * codec calls do no file I/O.
 */
public final class ImageCodec {

    /**
     * Quality for lossy encodes not set by a trailing {@code compress} operation.
     */
    public static final int DEFAULT_JPEG_QUALITY = 90;

    static {
        ImageIO.setUseCache(false);
    }

    /**
     * Intrinsic metadata of an encoded image.
     */
    public record ImageInfo(int width, int height, String mimeType) {
    }

    private ImageCodec() {
        // Utility class, no instantiation
    }

    /**
     * Reads dimensions and MIME type without decoding the pixels.
     *
     * @throws TransformExecutionException
     *             if the bytes are not a readable image
     */
    public static ImageInfo readInfo(byte[] bytes) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            ImageReader reader = firstReader(input);
            try {
                reader.setInput(input, true, true);
                String mimeType = mimeTypeFor(reader.getFormatName());
                return new ImageInfo(reader.getWidth(0), reader.getHeight(0), mimeType);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            throw new TransformExecutionException("Unreadable image: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes and converts to ARGB.
     *
     * @throws TransformExecutionException
     *             if the bytes are corrupt or in an unsupported encoding
     */
    public static BufferedImage decode(byte[] bytes) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new TransformExecutionException("Corrupt source image: " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new TransformExecutionException("Source bytes are not a supported image encoding");
        }
        return toArgb(decoded);
    }

    /**
     * Encodes an image.
     *
     * @param image
     *            pixels to encode
     * @param format
     *            target encoding
     * @param quality
     *            0-100, only honored by lossy formats
     * @param background
     *            fill used when alpha has to be flattened
     * @return encoded bytes
     * @throws TransformExecutionException
     *             if no writer exists or writing fails
     */
    public static byte[] encode(BufferedImage image, OutputFormat format, int quality, Color background) {
        BufferedImage writable = format.supportsAlpha() ? image : flatten(image, background);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(format.mimeType());
        if (!writers.hasNext()) {
            throw new TransformExecutionException("No encoder available for " + format.canonicalName());
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format.isLossy() && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                // webp-imageio needs the compression type set before the quality
                String[] compressionTypes = param.getCompressionTypes();
                if (compressionTypes != null && compressionTypes.length > 0) {
                    param.setCompressionType(compressionTypes[0]);
                }
                param.setCompressionQuality(quality / 100.0f);
            }
            writer.write(null, new IIOImage(writable, null, null), param);
            output.flush();
        } catch (IOException | RuntimeException e) {
            throw new TransformExecutionException("Failed to encode " + format.canonicalName() + ": " + e.getMessage(),
                    e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    /**
     * Draws an image onto an opaque RGB canvas filled with the background color.
     */
    public static BufferedImage flatten(BufferedImage image, Color background) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }

    private static ImageReader firstReader(ImageInputStream input) throws IOException {
        if (input == null) {
            throw new IOException("No image input stream for source bytes");
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new IOException("No compatible image reader");
        }
        return readers.next();
    }

    private static String mimeTypeFor(String formatName) {
        String normalized = formatName.toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "jpeg", "jpg" -> "image/jpeg";
            case "png" -> "image/png";
            case "gif" -> "image/gif";
            case "bmp" -> "image/bmp";
            case "webp" -> "image/webp";
            case "wbmp" -> "image/vnd.wap.wbmp";
            case "tif", "tiff" -> "image/tiff";
            default -> "image/" + normalized;
        };
    }
}

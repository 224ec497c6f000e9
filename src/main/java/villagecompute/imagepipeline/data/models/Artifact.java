/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data.models;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

import villagecompute.imagepipeline.transform.OutputFormat;

/**
 * Encoded result of a transformation, addressed by its fingerprint. The encoded bytes are copied on the way in and
 * on the way out, so a cached artifact cannot be altered by any holder. Equality compares the bytes by content.
 *
 * @param fingerprint
 *            content address
 * @param data
 *            encoded bytes
 * @param format
 *            encoding of {@code data}
 * @param width
 *            pixel width
 * @param height
 *            pixel height
 * @param storageKey
 *            object key of the persisted copy, null when the artifact was not persisted
 * @param createdAt
 *            production time
 */
public record Artifact(Fingerprint fingerprint, byte[] data, OutputFormat format, int width, int height,
        String storageKey, Instant createdAt) {

    public Artifact {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(format, "format");
        data = data.clone();
    }

    /**
     * @return a copy of the encoded bytes
     */
    @Override
    public byte[] data() {
        return data.clone();
    }

    public long sizeBytes() {
        return data.length;
    }

    public String mimeType() {
        return format.mimeType();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Artifact that)) {
            return false;
        }
        return width == that.width && height == that.height && fingerprint.equals(that.fingerprint)
                && Arrays.equals(data, that.data) && format == that.format
                && Objects.equals(storageKey, that.storageKey) && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, Arrays.hashCode(data), format, width, height, storageKey, createdAt);
    }

    @Override
    public String toString() {
        return "Artifact[fingerprint=" + fingerprint + ", format=" + format + ", " + width + "x" + height + ", "
                + data.length + " bytes, storageKey=" + storageKey + "]";
    }
}

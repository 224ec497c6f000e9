/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.data.models;

import java.util.Objects;

/**
 * Content address of a transformation result: lowercase hex SHA-256 over the source content hash, the canonical spec
 * and the output format.
 */
public record Fingerprint(String value) {

    public Fingerprint {
        Objects.requireNonNull(value, "value");
        if (value.length() != 64) {
            throw new IllegalArgumentException("Fingerprint must be 64 hex characters, got: " + value.length());
        }
    }

    /**
     * First 12 characters, for log lines.
     */
    public String shortValue() {
        return value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}

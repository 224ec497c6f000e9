/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformSpec;

/**
 * Derives content addresses for source images and transformation results.
 *
 * <p>
 * A fingerprint is SHA-256 over a versioned, newline separated preimage:
 *
 * <pre>
 * v1
 * &lt;source content hash&gt;
 * &lt;canonical spec&gt;
 * &lt;output format&gt;
 * </pre>
 *
 * <p>
 * The canonical spec already normalizes parameter order, numeric forms and defaults, so semantically equal requests
 * collide and anything that changes the output bytes changes the fingerprint. Bumping the version prefix invalidates
 * every previously issued fingerprint.
 */
@ApplicationScoped
public class FingerprintService {

    static final String VERSION = "v1";

    /**
     * Computes the fingerprint of a transformation.
     *
     * @param sourceContentHash
     *            lowercase hex SHA-256 of the source bytes
     * @param spec
     *            transformation spec
     * @param format
     *            effective output format
     * @return fingerprint, stable across processes and restarts
     */
    public Fingerprint compute(String sourceContentHash, TransformSpec spec, OutputFormat format) {
        Objects.requireNonNull(sourceContentHash, "sourceContentHash");
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(format, "format");

        String preimage = VERSION + "\n" + sourceContentHash + "\n" + spec.canonical() + "\n" + format.canonicalName();
        return new Fingerprint(sha256Hex(preimage.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hashes raw image bytes.
     *
     * @return lowercase hex SHA-256
     */
    public String contentHash(byte[] content) {
        return sha256Hex(content);
    }

    private static String sha256Hex(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}

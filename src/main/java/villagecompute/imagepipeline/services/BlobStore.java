/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import villagecompute.imagepipeline.api.types.SignedUrlType;

/**
 * Object storage holding source images and persisted artifacts.
 */
public interface BlobStore {

    /**
     * Stores bytes under the given key, replacing any existing object.
     */
    void upload(String objectKey, byte[] data, String contentType);

    /**
     * @throws villagecompute.imagepipeline.exceptions.ResourceNotFoundException
     *             if no object exists under the key
     */
    byte[] download(String objectKey);

    void delete(String objectKey);

    SignedUrlType generateSignedUrl(String objectKey, int ttlMinutes);
}

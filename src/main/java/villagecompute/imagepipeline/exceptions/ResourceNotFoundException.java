/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

/**
 * Exception thrown when a requested resource is not found (image, job).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

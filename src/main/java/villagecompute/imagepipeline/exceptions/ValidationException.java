/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

/**
 * Exception thrown when a transformation request is malformed (unknown operation, missing or out-of-range parameter,
 * crop region outside the source bounds, unsupported output format).
 *
 * <p>
 * Raised before a job is enqueued and never retried. Extends RuntimeException per project standards. Mapped to HTTP
 * 400 Bad Request.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

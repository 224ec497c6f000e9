/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

/**
 * Exception thrown by the artifact cache when its backend cannot serve requests.
 *
 * <p>
 * Callers absorb this exception and continue in degraded mode: the transformation still runs, only the result is not
 * cached.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

/**
 * Exception thrown when the admission controller denies a request because the caller exhausted its token bucket.
 *
 * <p>
 * Carries the number of seconds after which a retry can succeed. Mapped to HTTP 429 Too Many Requests with a
 * {@code Retry-After} header.
 */
public class ThrottledException extends RuntimeException {

    private final long retryAfterSeconds;
    private final String bucketKey;

    public ThrottledException(String message, long retryAfterSeconds, String bucketKey) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
        this.bucketKey = bucketKey;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getBucketKey() {
        return bucketKey;
    }
}

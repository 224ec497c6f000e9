/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.exceptions;

/**
 * Exception thrown when a transformation fails while running (corrupt source, no encoder for the target format,
 * resource exhaustion, storage failure).
 *
 * <p>
 * Recorded on the job, which becomes {@code FAILED}. Never retried automatically.
 */
public class TransformExecutionException extends RuntimeException {

    public TransformExecutionException(String message) {
        super(message);
    }

    public TransformExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import villagecompute.imagepipeline.exceptions.ThrottledException;

/**
 * Maps {@link ThrottledException} to 429 Too Many Requests with {@code Retry-After} and
 * {@code X-RateLimit-Remaining: 0}.
 */
@Provider
public class ThrottledExceptionMapper implements ExceptionMapper<ThrottledException> {

    private static final Logger LOG = Logger.getLogger(ThrottledExceptionMapper.class);

    @Override
    public Response toResponse(ThrottledException exception) {
        LOG.infof("Throttled request: bucket=%s retryAfter=%ds", exception.getBucketKey(),
                exception.getRetryAfterSeconds());
        return Response.status(429).type(MediaType.APPLICATION_JSON)
                .header("Retry-After", exception.getRetryAfterSeconds()).header("X-RateLimit-Remaining", 0)
                .entity(Map.of("error", exception.getMessage(), "retry_after_seconds",
                        exception.getRetryAfterSeconds()))
                .build();
    }
}

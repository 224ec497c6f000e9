/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching pipeline logs with request and job context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - Authenticated requester (absent for anonymous calls)</li>
 * <li>{@code image_id} - Source image being read or transformed</li>
 * <li>{@code job_id} - Transformation job (worker threads and status calls)</li>
 * <li>{@code fingerprint} - Artifact content address</li>
 * <li>{@code rate_limit_bucket} - Admission bucket key (action + subject)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Workers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id());
 * LoggingConfig.setFingerprint(job.fingerprint().value());
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Pooled threads must clear
 * the MDC when a unit of work ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Authenticated user id. Absent for anonymous requests, which are keyed by IP address instead.
     */
    public static final String MDC_USER_ID = "user_id";

    public static final String MDC_IMAGE_ID = "image_id";

    public static final String MDC_JOB_ID = "job_id";

    /**
     * Full hex fingerprint of the artifact being produced or served.
     */
    public static final String MDC_FINGERPRINT = "fingerprint";

    /**
     * Admission bucket key (e.g., "transform:u:alice" or "read:ip:203.0.113.7").
     */
    public static final String MDC_RATE_LIMIT_BUCKET = "rate_limit_bucket";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no span is
     * active so the log structure stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setUserId(String userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId);
        }
    }

    public static void setImageId(String imageId) {
        if (imageId != null) {
            MDC.put(MDC_IMAGE_ID, imageId);
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    public static void setFingerprint(String fingerprint) {
        if (fingerprint != null) {
            MDC.put(MDC_FINGERPRINT, fingerprint);
        }
    }

    public static void setRateLimitBucket(String rateLimitBucket) {
        if (rateLimitBucket != null) {
            MDC.put(MDC_RATE_LIMIT_BUCKET, rateLimitBucket);
        }
    }

    /**
     * Clears all pipeline MDC fields. Called at the end of every request and job.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_IMAGE_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_FINGERPRINT);
        MDC.remove(MDC_RATE_LIMIT_BUCKET);
    }
}

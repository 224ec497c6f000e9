/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.exceptions.ThrottledException;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.observability.PipelineMetrics;

/**
 * Token-bucket admission control per (action class, requester).
 *
 * <p>
 * Each bucket holds up to {@code burst} tokens and refills continuously at {@code refill-per-second}. A request costs
 * one token. Limits are configured per action class:
 *
 * <pre>
 * imagepipeline.admission.upload.burst=10
 * imagepipeline.admission.upload.refill-per-second=0.5
 * imagepipeline.admission.transform.burst=20
 * imagepipeline.admission.transform.refill-per-second=2
 * imagepipeline.admission.read.burst=120
 * imagepipeline.admission.read.refill-per-second=20
 * </pre>
 *
 * <p>
 * Authenticated requesters are keyed by user id, anonymous ones by IP address. Requesters never share buckets, so one
 * requester's overuse never throttles another. Idle buckets are expired from memory after an hour; a fresh bucket
 * starts full, which matches what an hour of refill would give.
 *
 * <p>
 * <b>Thread Safety:</b> Buckets are updated under their own monitor; different requesters never contend.
 */
@ApplicationScoped
public class AdmissionControlService {

    private static final Logger LOG = Logger.getLogger(AdmissionControlService.class);

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "imagepipeline.admission.upload.burst",
            defaultValue = "10")
    int uploadBurst;

    @ConfigProperty(
            name = "imagepipeline.admission.upload.refill-per-second",
            defaultValue = "0.5")
    double uploadRefillPerSecond;

    @ConfigProperty(
            name = "imagepipeline.admission.transform.burst",
            defaultValue = "20")
    int transformBurst;

    @ConfigProperty(
            name = "imagepipeline.admission.transform.refill-per-second",
            defaultValue = "2")
    double transformRefillPerSecond;

    @ConfigProperty(
            name = "imagepipeline.admission.read.burst",
            defaultValue = "120")
    int readBurst;

    @ConfigProperty(
            name = "imagepipeline.admission.read.refill-per-second",
            defaultValue = "20")
    double readRefillPerSecond;

    Clock clock = Clock.systemUTC();

    private final Cache<String, TokenBucket> buckets = Caffeine.newBuilder().expireAfterAccess(1, TimeUnit.HOURS)
            .maximumSize(100_000).build();

    /**
     * Request classes with independent limits.
     */
    public enum ActionClass {
        UPLOAD, TRANSFORM, READ;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Outcome of an admission check.
     *
     * @param allowed
     *            whether the request may proceed
     * @param remaining
     *            whole tokens left after this request
     * @param retryAfterSeconds
     *            seconds until one token is available, 0 when allowed
     * @param bucketKey
     *            bucket that was charged
     */
    public record AdmissionDecision(boolean allowed, long remaining, long retryAfterSeconds, String bucketKey) {
    }

    private static final class TokenBucket {
        private final int capacity;
        private final double refillPerSecond;
        private double tokens;
        private long lastRefillNanos;

        TokenBucket(int capacity, double refillPerSecond, long nowNanos) {
            this.capacity = capacity;
            this.refillPerSecond = refillPerSecond;
            this.tokens = capacity;
            this.lastRefillNanos = nowNanos;
        }

        void refill(long nowNanos) {
            long elapsed = nowNanos - lastRefillNanos;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + (elapsed / 1_000_000_000.0) * refillPerSecond);
                lastRefillNanos = nowNanos;
            }
        }
    }

    /**
     * Charges one token if available.
     *
     * @return true if the request is admitted
     */
    public boolean allow(RequestIdentity identity, ActionClass action) {
        return check(identity, action).allowed();
    }

    /**
     * Charges one token if available and reports the bucket state.
     */
    public AdmissionDecision check(RequestIdentity identity, ActionClass action) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(action, "action");

        String bucketKey = bucketKey(identity, action);
        long now = nowNanos();
        TokenBucket bucket = buckets.get(bucketKey, k -> new TokenBucket(burst(action), refillPerSecond(action), now));

        AdmissionDecision decision;
        synchronized (bucket) {
            bucket.refill(now);
            if (bucket.tokens >= 1.0) {
                bucket.tokens -= 1.0;
                decision = new AdmissionDecision(true, (long) Math.floor(bucket.tokens), 0, bucketKey);
            } else {
                long retryAfter = (long) Math.ceil((1.0 - bucket.tokens) / bucket.refillPerSecond);
                decision = new AdmissionDecision(false, 0, Math.max(1, retryAfter), bucketKey);
            }
        }

        LoggingConfig.setRateLimitBucket(bucketKey);
        metrics.incrementAdmissionCheck(action.key(), decision.allowed());
        if (!decision.allowed()) {
            LOG.warnf("Admission denied: bucket=%s retryAfter=%ds", bucketKey, decision.retryAfterSeconds());
        }
        return decision;
    }

    /**
     * Charges one token or throws.
     *
     * @throws ThrottledException
     *             if the bucket is empty
     */
    public AdmissionDecision enforce(RequestIdentity identity, ActionClass action) {
        AdmissionDecision decision = check(identity, action);
        if (!decision.allowed()) {
            throw new ThrottledException("Rate limit exceeded for " + action.key() + ", retry after "
                    + decision.retryAfterSeconds() + "s", decision.retryAfterSeconds(), decision.bucketKey());
        }
        return decision;
    }

    /**
     * Reports whole tokens currently available without charging.
     */
    public long remaining(RequestIdentity identity, ActionClass action) {
        TokenBucket bucket = buckets.getIfPresent(bucketKey(identity, action));
        if (bucket == null) {
            return burst(action);
        }
        synchronized (bucket) {
            bucket.refill(nowNanos());
            return (long) Math.floor(bucket.tokens);
        }
    }

    /**
     * Clears all buckets. Intended for tests and operational resets.
     */
    public void reset() {
        buckets.invalidateAll();
        LOG.info("Reset all admission buckets");
    }

    private static String bucketKey(RequestIdentity identity, ActionClass action) {
        return action.key() + ":" + identity.rateLimitKey();
    }

    private long nowNanos() {
        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    private int burst(ActionClass action) {
        return switch (action) {
            case UPLOAD -> uploadBurst;
            case TRANSFORM -> transformBurst;
            case READ -> readBurst;
        };
    }

    private double refillPerSecond(ActionClass action) {
        return switch (action) {
            case UPLOAD -> uploadRefillPerSecond;
            case TRANSFORM -> transformRefillPerSecond;
            case READ -> readRefillPerSecond;
        };
    }
}

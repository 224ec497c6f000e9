/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import io.micrometer.core.instrument.Gauge;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.exceptions.CacheUnavailableException;
import villagecompute.imagepipeline.observability.PipelineMetrics;

/**
 * Bounded in-memory store of artifacts keyed by fingerprint.
 *
 * <p>
 * The cache is bounded by total artifact bytes when {@code imagepipeline.cache.max-bytes} is positive, otherwise by
 * entry count. Eviction follows Caffeine's size policy (recency and frequency); eviction never affects correctness
 * since any artifact can be recomputed from its fingerprint inputs.
 *
 * <p>
 * A secondary index maps source content hashes to the fingerprints derived from them, so deleting a source image can
 * drop every artifact built from it.
 *
 * <p>
 * <b>Degraded mode:</b> when the cache is disabled or an operation fails internally, every method throws
 * {@link CacheUnavailableException}. Callers log and continue without caching.
 */
@ApplicationScoped
public class ArtifactCacheService {

    private static final Logger LOG = Logger.getLogger(ArtifactCacheService.class);

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "imagepipeline.cache.max-entries",
            defaultValue = "1000")
    long maxEntries;

    @ConfigProperty(
            name = "imagepipeline.cache.max-bytes",
            defaultValue = "268435456")
    long maxBytes;

    @ConfigProperty(
            name = "imagepipeline.cache.enabled",
            defaultValue = "true")
    boolean enabled;

    private Cache<Fingerprint, CachedArtifact> cache;

    private final ConcurrentMap<String, Set<Fingerprint>> fingerprintsBySource = new ConcurrentHashMap<>();

    private final AtomicLong totalBytes = new AtomicLong();

    private final AtomicBoolean degraded = new AtomicBoolean();

    /**
     * Point-in-time view of cache occupancy and effectiveness.
     */
    public record CacheSnapshot(long entries, long bytes, long hits, long misses, long evictions, double hitRate,
            boolean enabled) {
    }

    private record CachedArtifact(Artifact artifact, String sourceContentHash) {
    }

    @PostConstruct
    void init() {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().executor(Runnable::run).recordStats();
        if (maxBytes > 0) {
            builder.maximumWeight(maxBytes).weigher(
                    (Fingerprint key, CachedArtifact value) -> (int) Math.min(Integer.MAX_VALUE,
                            value.artifact().sizeBytes()));
        } else {
            builder.maximumSize(maxEntries);
        }
        cache = builder.removalListener(this::onRemoval).build();

        Gauge.builder("imagepipeline_cache_entries", this, c -> c.estimatedEntries())
                .description("Artifacts currently held in the cache").register(metrics.getRegistry());
        Gauge.builder("imagepipeline_cache_bytes", totalBytes, AtomicLong::get)
                .description("Total encoded bytes held in the cache").register(metrics.getRegistry());

        if (enabled) {
            LOG.infof("Artifact cache initialized (maxBytes=%d, maxEntries=%d)", maxBytes, maxEntries);
        } else {
            degraded.set(true);
            LOG.warn("Artifact cache disabled, pipeline running in degraded mode without caching");
        }
    }

    /**
     * Looks up an artifact.
     *
     * @throws CacheUnavailableException
     *             if the cache is disabled or failing
     */
    public Optional<Artifact> get(Fingerprint fingerprint) {
        ensureEnabled();
        try {
            CachedArtifact cached = cache.getIfPresent(fingerprint);
            metrics.incrementCacheRequest(cached != null ? "hit" : "miss");
            markHealthy();
            return Optional.ofNullable(cached).map(CachedArtifact::artifact);
        } catch (RuntimeException e) {
            metrics.incrementCacheRequest("unavailable");
            markDegraded(e);
            throw new CacheUnavailableException("Artifact cache lookup failed: " + e.getMessage(), e);
        }
    }

    /**
     * Stores an artifact. Artifacts larger than the byte bound are accepted and immediately evicted.
     *
     * @param artifact
     *            artifact to store, keyed by its fingerprint
     * @param sourceContentHash
     *            content hash of the source it was derived from
     * @throws CacheUnavailableException
     *             if the cache is disabled or failing
     */
    public void put(Artifact artifact, String sourceContentHash) {
        ensureEnabled();
        try {
            fingerprintsBySource.computeIfAbsent(sourceContentHash, k -> ConcurrentHashMap.newKeySet())
                    .add(artifact.fingerprint());
            totalBytes.addAndGet(artifact.sizeBytes());
            cache.put(artifact.fingerprint(), new CachedArtifact(artifact, sourceContentHash));
            LOG.debugf("Cached artifact %s (%d bytes)", artifact.fingerprint().shortValue(), artifact.sizeBytes());
            markHealthy();
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new CacheUnavailableException("Artifact cache write failed: " + e.getMessage(), e);
        }
    }

    public void invalidate(Fingerprint fingerprint) {
        ensureEnabled();
        cache.invalidate(fingerprint);
    }

    /**
     * Drops every artifact derived from the given source content.
     *
     * @return number of fingerprints invalidated
     */
    public int invalidateSource(String sourceContentHash) {
        ensureEnabled();
        Set<Fingerprint> fingerprints = fingerprintsBySource.remove(sourceContentHash);
        if (fingerprints == null || fingerprints.isEmpty()) {
            return 0;
        }
        cache.invalidateAll(fingerprints);
        LOG.infof("Invalidated %d artifacts derived from source %s", fingerprints.size(), sourceContentHash);
        return fingerprints.size();
    }

    public CacheSnapshot stats() {
        if (!enabled) {
            return new CacheSnapshot(0, 0, 0, 0, 0, 0.0, false);
        }
        cache.cleanUp();
        CacheStats stats = cache.stats();
        return new CacheSnapshot(cache.estimatedSize(), totalBytes.get(), stats.hitCount(), stats.missCount(),
                stats.evictionCount(), stats.hitRate(), true);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    private long estimatedEntries() {
        return enabled ? cache.estimatedSize() : 0;
    }

    private void onRemoval(Fingerprint fingerprint, CachedArtifact cached, RemovalCause cause) {
        if (cached == null) {
            return;
        }
        totalBytes.addAndGet(-cached.artifact().sizeBytes());
        if (cause != RemovalCause.REPLACED) {
            Set<Fingerprint> siblings = fingerprintsBySource.get(cached.sourceContentHash());
            if (siblings != null) {
                siblings.remove(fingerprint);
            }
        }
        if (cause.wasEvicted()) {
            LOG.debugf("Evicted artifact %s (%s)", fingerprint.shortValue(), cause);
        }
    }

    private void markDegraded(RuntimeException cause) {
        if (degraded.compareAndSet(false, true)) {
            LOG.warnf(cause, "Artifact cache failing, entering degraded mode without caching");
        }
    }

    private void markHealthy() {
        if (degraded.compareAndSet(true, false)) {
            LOG.info("Artifact cache recovered, leaving degraded mode");
        }
    }

    private void ensureEnabled() {
        if (!enabled) {
            throw new CacheUnavailableException("Artifact cache is disabled");
        }
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.exceptions.CacheUnavailableException;
import villagecompute.imagepipeline.observability.PipelineMetrics;
import villagecompute.imagepipeline.services.ArtifactCacheService.CacheSnapshot;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformSpecParser;

/**
 * Unit tests for ArtifactCacheService covering lookups, source invalidation, the byte bound and degraded mode.
 */
class ArtifactCacheServiceTest {

    private final FingerprintService fingerprints = new FingerprintService();

    private SimpleMeterRegistry registry;

    private final String sourceA = fingerprints.contentHash("source-a".getBytes(StandardCharsets.UTF_8));
    private final String sourceB = fingerprints.contentHash("source-b".getBytes(StandardCharsets.UTF_8));

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private ArtifactCacheService newCache(long maxBytes, long maxEntries, boolean enabled) {
        ArtifactCacheService cache = new ArtifactCacheService();
        cache.metrics = new PipelineMetrics(registry);
        cache.maxBytes = maxBytes;
        cache.maxEntries = maxEntries;
        cache.enabled = enabled;
        cache.init();
        return cache;
    }

    private Artifact artifact(String sourceHash, int width, int sizeBytes) {
        Fingerprint fingerprint = fingerprints.compute(sourceHash,
                TransformSpecParser.fromCompact("resize(width=" + width + ")"), OutputFormat.JPEG);
        return new Artifact(fingerprint, new byte[sizeBytes], OutputFormat.JPEG, width, width, "artifacts/x.jpg",
                Instant.parse("2025-01-15T10:00:00Z"));
    }

    private double cacheRequests(String result) {
        return registry.get("imagepipeline_cache_requests_total").tag("result", result).counter().count();
    }

    @Test
    void testCachedBytes_cannotBeAlteredByCaller() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        byte[] encoded = {1, 2, 3, 4};
        Fingerprint fingerprint = fingerprints.compute(sourceA, TransformSpecParser.fromCompact("grayscale()"),
                OutputFormat.PNG);
        cache.put(new Artifact(fingerprint, encoded, OutputFormat.PNG, 2, 2, null,
                Instant.parse("2025-01-15T10:00:00Z")), sourceA);

        encoded[0] = 9;
        cache.get(fingerprint).orElseThrow().data()[1] = 9;

        assertArrayEquals(new byte[] {1, 2, 3, 4}, cache.get(fingerprint).orElseThrow().data());
    }

    @Test
    void testArtifactEquality_comparesBytesByContent() {
        Artifact first = artifact(sourceA, 100, 16);
        Artifact second = new Artifact(first.fingerprint(), new byte[16], first.format(), first.width(),
                first.height(), first.storageKey(), first.createdAt());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void testGet_missThenHit() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        Artifact artifact = artifact(sourceA, 100, 500);

        assertTrue(cache.get(artifact.fingerprint()).isEmpty());
        cache.put(artifact, sourceA);

        assertSame(artifact, cache.get(artifact.fingerprint()).orElseThrow());
        assertEquals(1.0, cacheRequests("hit"));
        assertEquals(1.0, cacheRequests("miss"));

        CacheSnapshot stats = cache.stats();
        assertEquals(1, stats.entries());
        assertEquals(500, stats.bytes());
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5, stats.hitRate(), 0.0001);
        assertTrue(stats.enabled());
    }

    @Test
    void testPut_sameFingerprintReplacesWithoutDoubleCountingBytes() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        Artifact artifact = artifact(sourceA, 100, 300);

        cache.put(artifact, sourceA);
        cache.put(artifact, sourceA);

        CacheSnapshot stats = cache.stats();
        assertEquals(1, stats.entries());
        assertEquals(300, stats.bytes());
    }

    @Test
    void testInvalidate_removesSingleEntry() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        Artifact artifact = artifact(sourceA, 100, 100);
        cache.put(artifact, sourceA);

        cache.invalidate(artifact.fingerprint());

        assertTrue(cache.get(artifact.fingerprint()).isEmpty());
        assertEquals(0, cache.stats().bytes());
    }

    @Test
    void testInvalidateSource_dropsOnlyDerivedArtifacts() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        Artifact a1 = artifact(sourceA, 100, 100);
        Artifact a2 = artifact(sourceA, 200, 100);
        Artifact b1 = artifact(sourceB, 100, 100);
        cache.put(a1, sourceA);
        cache.put(a2, sourceA);
        cache.put(b1, sourceB);

        int invalidated = cache.invalidateSource(sourceA);

        assertEquals(2, invalidated);
        assertTrue(cache.get(a1.fingerprint()).isEmpty());
        assertTrue(cache.get(a2.fingerprint()).isEmpty());
        assertTrue(cache.get(b1.fingerprint()).isPresent());
        assertEquals(0, cache.invalidateSource(sourceA));
    }

    @Test
    void testByteBound_evictsToStayWithinLimit() {
        ArtifactCacheService cache = newCache(1000, 1000, true);

        cache.put(artifact(sourceA, 100, 400), sourceA);
        cache.put(artifact(sourceA, 200, 400), sourceA);
        cache.put(artifact(sourceA, 300, 400), sourceA);

        CacheSnapshot stats = cache.stats();
        assertTrue(stats.bytes() <= 1000, "Cached bytes should stay within the bound, was " + stats.bytes());
        assertTrue(stats.evictions() >= 1);
        assertEquals(2, stats.entries());
    }

    @Test
    void testOversizedArtifact_acceptedThenEvicted() {
        ArtifactCacheService cache = newCache(1000, 1000, true);
        Artifact huge = artifact(sourceA, 100, 5000);

        cache.put(huge, sourceA);

        assertEquals(0, cache.stats().entries());
        assertTrue(cache.get(huge.fingerprint()).isEmpty());
    }

    @Test
    void testEntryBound_usedWhenByteBoundUnset() {
        ArtifactCacheService cache = newCache(0, 2, true);

        cache.put(artifact(sourceA, 100, 10), sourceA);
        cache.put(artifact(sourceA, 200, 10), sourceA);
        cache.put(artifact(sourceA, 300, 10), sourceA);

        assertEquals(2, cache.stats().entries());
    }

    @Test
    void testGauges_registered() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, true);
        cache.put(artifact(sourceA, 100, 250), sourceA);

        assertEquals(1.0, registry.get("imagepipeline_cache_entries").gauge().value());
        assertEquals(250.0, registry.get("imagepipeline_cache_bytes").gauge().value());
    }

    @Test
    void testDisabled_operationsReportUnavailable() {
        ArtifactCacheService cache = newCache(1_000_000, 1000, false);
        Artifact artifact = artifact(sourceA, 100, 100);

        assertFalse(cache.isEnabled());
        assertTrue(cache.isDegraded());
        assertThrows(CacheUnavailableException.class, () -> cache.get(artifact.fingerprint()));
        assertThrows(CacheUnavailableException.class, () -> cache.put(artifact, sourceA));
        assertThrows(CacheUnavailableException.class, () -> cache.invalidateSource(sourceA));

        CacheSnapshot stats = cache.stats();
        assertFalse(stats.enabled());
        assertEquals(0, stats.entries());
    }
}

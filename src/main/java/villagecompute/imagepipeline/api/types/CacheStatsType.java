/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.imagepipeline.services.ArtifactCacheService.CacheSnapshot;

/**
 * Artifact cache statistics.
 *
 * @param enabled
 *            false when the pipeline runs without a cache
 * @param degraded
 *            true while cache operations are failing or the cache is disabled
 * @param entries
 *            artifacts held
 * @param bytes
 *            total encoded bytes held
 * @param hits
 *            lookups answered from cache
 * @param misses
 *            lookups that found nothing
 * @param evictions
 *            entries removed by the size policy
 * @param hitRate
 *            hits / (hits + misses), 0.0-1.0
 */
public record CacheStatsType(@JsonProperty("enabled") boolean enabled, @JsonProperty("degraded") boolean degraded,
        @JsonProperty("entries") long entries, @JsonProperty("bytes") long bytes, @JsonProperty("hits") long hits,
        @JsonProperty("misses") long misses, @JsonProperty("evictions") long evictions,
        @JsonProperty("hit_rate") double hitRate) {

    public static CacheStatsType fromSnapshot(CacheSnapshot snapshot, boolean degraded) {
        return new CacheStatsType(snapshot.enabled(), degraded, snapshot.entries(), snapshot.bytes(), snapshot.hits(),
                snapshot.misses(), snapshot.evictions(), snapshot.hitRate());
    }
}

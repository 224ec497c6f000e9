/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import villagecompute.imagepipeline.api.types.CacheStatsType;
import villagecompute.imagepipeline.services.ArtifactCacheService;

/**
 * Operator view of the artifact cache.
 */
@Path("/api/admin/cache")
@RolesAllowed("admin")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Admin",
        description = "Operational endpoints")
public class CacheAdminResource {

    @Inject
    ArtifactCacheService cacheService;

    @GET
    @Path("/stats")
    @Operation(
            summary = "Cache statistics",
            description = "Entries, bytes, hits, misses and evictions of the artifact cache")
    public CacheStatsType stats() {
        return CacheStatsType.fromSnapshot(cacheService.stats(), cacheService.isDegraded());
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.imagepipeline.api.types.JobStatusType;
import villagecompute.imagepipeline.exceptions.ValidationException;
import villagecompute.imagepipeline.jobs.JobStatusSnapshot;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.services.BlobStore;
import villagecompute.imagepipeline.services.DeliveryService;

/**
 * REST endpoints for transformation jobs.
 *
 * <ul>
 * <li>{@code GET /api/jobs/{jobId}} – current status</li>
 * <li>{@code GET /api/jobs/{jobId}/wait?timeoutMs=} – block until terminal or timeout</li>
 * <li>{@code DELETE /api/jobs/{jobId}} – cancel a queued job</li>
 * </ul>
 *
 * <p>
 * Failed and timed out jobs return 200 with the error in the payload.
 */
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Jobs",
        description = "Transformation job status and control")
public class JobResource {

    private static final Logger LOG = Logger.getLogger(JobResource.class);

    static final long MAX_WAIT_MS = 30_000;

    @Inject
    RequestIdentityResolver identityResolver;

    @Inject
    DeliveryService deliveryService;

    @Inject
    BlobStore blobStore;

    @ConfigProperty(
            name = "imagepipeline.storage.signed-url-ttl-minutes",
            defaultValue = "60")
    int signedUrlTtlMinutes;

    @GET
    @Path("/{jobId}")
    @Operation(
            summary = "Job status",
            description = "State plus artifact reference when succeeded or error detail when failed")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Job status"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown or reclaimed job")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response status(@PathParam("jobId") String jobId) {
        try {
            return toResponse(deliveryService.jobStatus(jobId, identityResolver.current()));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/{jobId}/wait")
    @Operation(
            summary = "Wait for job",
            description = "Blocks up to timeoutMs (max 30000) for the job to finish, then returns its status")
    @SecurityRequirement(
            name = "bearerAuth")
    public Response await(@PathParam("jobId") String jobId,
            @QueryParam("timeoutMs") @DefaultValue("10000") long timeoutMs) {
        if (timeoutMs < 0 || timeoutMs > MAX_WAIT_MS) {
            throw new ValidationException("timeoutMs must be between 0 and " + MAX_WAIT_MS);
        }
        try {
            return toResponse(
                    deliveryService.awaitJob(jobId, Duration.ofMillis(timeoutMs), identityResolver.current()));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @DELETE
    @Path("/{jobId}")
    @Operation(
            summary = "Cancel job",
            description = "Cancels a queued job; running jobs finish and their result is cached")
    @SecurityRequirement(
            name = "bearerAuth")
    public Response cancel(@PathParam("jobId") String jobId) {
        try {
            return toResponse(deliveryService.cancelJob(jobId, identityResolver.current()));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private Response toResponse(JobStatusSnapshot snapshot) {
        String url = null;
        if (snapshot.artifact() != null && snapshot.artifact().storageKey() != null) {
            try {
                url = blobStore.generateSignedUrl(snapshot.artifact().storageKey(), signedUrlTtlMinutes).url();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to generate signed URL for job %s", snapshot.jobId());
            }
        }
        return Response.ok(JobStatusType.fromSnapshot(snapshot, url)).build();
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.imagepipeline.api.types.ArtifactType;
import villagecompute.imagepipeline.api.types.DeliveryType;
import villagecompute.imagepipeline.api.types.ImageType;
import villagecompute.imagepipeline.api.types.TransformRequestType;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.services.BlobStore;
import villagecompute.imagepipeline.services.DeliveryResult;
import villagecompute.imagepipeline.services.DeliveryService;
import villagecompute.imagepipeline.services.ImageCatalogService;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformSpec;
import villagecompute.imagepipeline.transform.TransformSpecParser;

/**
 * REST endpoints for source images and their transformations.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/images} – upload an original (raw bytes)</li>
 * <li>{@code DELETE /api/images/{imageId}} – delete an original and its cached derivatives</li>
 * <li>{@code POST /api/images/{imageId}/transforms} – submit a transformation</li>
 * <li>{@code GET /api/images/{imageId}} – resolve the original or a transformation reference</li>
 * <li>{@code GET /api/images/{imageId}/content} – resolve and stream the bytes</li>
 * </ul>
 *
 * <p>
 * The {@code spec} query parameter uses the compact encoding, e.g. {@code resize(width=400)|grayscale()}. Responses
 * are 200 when the result is available and 202 with a job id when it is being produced.
 */
@Path("/api/images")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Images",
        description = "Image upload, transformation and delivery")
public class ImageTransformResource {

    private static final Logger LOG = Logger.getLogger(ImageTransformResource.class);

    static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";

    @Inject
    RequestIdentityResolver identityResolver;

    @Inject
    DeliveryService deliveryService;

    @Inject
    ImageCatalogService imageCatalog;

    @Inject
    BlobStore blobStore;

    @ConfigProperty(
            name = "imagepipeline.storage.signed-url-ttl-minutes",
            defaultValue = "60")
    int signedUrlTtlMinutes;

    @POST
    @Consumes({MediaType.APPLICATION_OCTET_STREAM, "image/*"})
    @Operation(
            summary = "Upload image",
            description = "Stores an original image owned by the caller")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Image registered",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "400",
                            description = "Empty body or unreadable image"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Upload rate limit exceeded")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response upload(byte[] body) {
        try {
            ImageRecord image = imageCatalog.upload(identityResolver.current(), body);
            return Response.status(Response.Status.CREATED).entity(ImageType.fromRecord(image)).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @DELETE
    @Path("/{imageId}")
    @Operation(
            summary = "Delete image",
            description = "Deletes an original owned by the caller and drops cached artifacts derived from it")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Deleted"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Image not owned by caller"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Image not found")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response delete(@PathParam("imageId") String imageId) {
        try {
            imageCatalog.delete(imageId, identityResolver.current());
            return Response.noContent().build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @POST
    @Path("/{imageId}/transforms")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Submit transformation",
            description = "Returns the cached artifact or a job handle to poll")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Artifact available from cache",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "202",
                            description = "Job queued or already running for the same result",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "400",
                            description = "Malformed spec or parameters out of range"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Image not owned by caller"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Image not found"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Transform rate limit exceeded or worker queue full")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response submitTransform(@PathParam("imageId") String imageId,
            @Valid @NotNull TransformRequestType request) {
        try {
            TransformSpec spec = TransformSpecParser.fromOperations(request.operations());
            OutputFormat format = parseFormat(request.format());
            DeliveryResult result = deliveryService.submitTransform(imageId, spec, format,
                    identityResolver.current());
            return toResponse(result);
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/{imageId}")
    @Operation(
            summary = "Resolve image",
            description = "Without a spec returns the original; with a spec returns the artifact or a job handle")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Original or cached artifact"),
                    @APIResponse(
                            responseCode = "202",
                            description = "Artifact is being produced"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Image not found")})
    @SecurityRequirement(
            name = "bearerAuth")
    public Response resolve(@PathParam("imageId") String imageId, @Parameter(
            description = "Compact spec, e.g. resize(width=400)|grayscale()") @QueryParam("spec") String spec,
            @QueryParam("format") String format) {
        try {
            DeliveryResult result = deliveryService.resolve(imageId, TransformSpecParser.fromCompact(spec),
                    parseFormat(format), identityResolver.current());
            return toResponse(result);
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/{imageId}/content")
    @Produces({"image/*", MediaType.APPLICATION_JSON})
    @Operation(
            summary = "Fetch image bytes",
            description = "Streams the original or cached artifact; returns 202 with a job id while it is produced")
    @SecurityRequirement(
            name = "bearerAuth")
    public Response content(@PathParam("imageId") String imageId, @QueryParam("spec") String spec,
            @QueryParam("format") String format) {
        try {
            DeliveryResult result = deliveryService.resolve(imageId, TransformSpecParser.fromCompact(spec),
                    parseFormat(format), identityResolver.current());
            return switch (result.kind()) {
                case READY -> Response.ok(result.artifact().data(), result.artifact().mimeType())
                        .header(RATE_LIMIT_REMAINING_HEADER, result.rateLimitRemaining()).build();
                case ORIGINAL -> Response.ok(blobStore.download(result.image().storageKey()), result.image().mimeType())
                        .header(RATE_LIMIT_REMAINING_HEADER, result.rateLimitRemaining()).build();
                case PENDING -> toResponse(result);
            };
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private Response toResponse(DeliveryResult result) {
        ImageType image = ImageType.fromRecord(result.image());
        DeliveryType body = switch (result.kind()) {
            case READY -> new DeliveryType("ready", image, result.fingerprint().value(),
                    ArtifactType.fromArtifact(result.artifact(), signedUrl(result.artifact())), null, null);
            case ORIGINAL -> new DeliveryType("original", image, null, null, null,
                    signedUrl(result.image().storageKey()));
            case PENDING -> new DeliveryType("pending", image, result.fingerprint().value(), null,
                    result.job().jobId(), null);
        };
        Response.Status status = result.kind() == DeliveryResult.Kind.PENDING
                ? Response.Status.ACCEPTED
                : Response.Status.OK;
        return Response.status(status).entity(body).header(RATE_LIMIT_REMAINING_HEADER, result.rateLimitRemaining())
                .build();
    }

    private String signedUrl(Artifact artifact) {
        return artifact.storageKey() == null ? null : signedUrl(artifact.storageKey());
    }

    private String signedUrl(String storageKey) {
        try {
            return blobStore.generateSignedUrl(storageKey, signedUrlTtlMinutes).url();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to generate signed URL for %s", storageKey);
            return null;
        }
    }

    private static OutputFormat parseFormat(String format) {
        return format == null || format.isBlank() ? null : OutputFormat.fromName(format);
    }
}

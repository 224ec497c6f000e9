/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import villagecompute.imagepipeline.api.types.SignedUrlType;
import villagecompute.imagepipeline.exceptions.ResourceNotFoundException;

/**
 * S3-compatible {@link BlobStore} for source images and persisted artifacts.
 *
 * <p>
 * Works against any S3 API (MinIO for dev, Cloudflare R2 or AWS S3 for prod). All objects live in one bucket; source
 * images under {@code originals/} and artifacts under {@code artifacts/}.
 *
 * <p>
 * Every call is traced with an OpenTelemetry span ({@code storage.upload}, {@code storage.download},
 * {@code storage.delete}, {@code storage.generate_signed_url}) and counted in
 * {@code imagepipeline_storage_operations_total{operation,status}}.
 */
@ApplicationScoped
public class StorageGateway implements BlobStore {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    @Inject
    S3Client s3Client;

    @Inject
    S3Presigner s3Presigner;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "imagepipeline.storage.bucket")
    String bucket;

    @Override
    public void upload(String objectKey, byte[] data, String contentType) {
        Span span = tracer.spanBuilder("storage.upload").setAttribute("bucket", bucket)
                .setAttribute("object_key", objectKey).setAttribute("size_bytes", data.length).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucket).key(objectKey)
                    .contentType(contentType)
                    .metadata(Map.of("service", "image-pipeline", "uploaded-at", Instant.now().toString())).build();

            s3Client.putObject(putRequest, RequestBody.fromBytes(data));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.infof("Uploaded %s/%s (%d bytes, %dms)", bucket, objectKey, data.length, latencyMs);

            recordMetrics("upload", latencyMs, true);
            span.setAttribute("upload_success", true);

        } catch (S3Exception e) {
            recordMetrics("upload", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("upload_success", false);
            LOG.errorf(e, "Failed to upload %s/%s: %s", bucket, objectKey, errorMessage(e));
            throw new RuntimeException("Storage upload failed: " + errorMessage(e), e);

        } finally {
            span.end();
        }
    }

    @Override
    public byte[] download(String objectKey) {
        Span span = tracer.spanBuilder("storage.download").setAttribute("bucket", bucket)
                .setAttribute("object_key", objectKey).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucket).key(objectKey).build();

            byte[] bytes = s3Client.getObjectAsBytes(getRequest).asByteArray();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Downloaded %s/%s (%d bytes, %dms)", bucket, objectKey, bytes.length, latencyMs);

            recordMetrics("download", latencyMs, true);
            span.setAttribute("download_success", true);
            span.setAttribute("size_bytes", bytes.length);

            return bytes;

        } catch (NoSuchKeyException e) {
            recordMetrics("download", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            throw new ResourceNotFoundException("Object not found: " + objectKey, e);

        } catch (S3Exception e) {
            recordMetrics("download", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("download_success", false);
            LOG.errorf(e, "Failed to download %s: %s", objectKey, errorMessage(e));
            throw new RuntimeException("Storage download failed: " + errorMessage(e), e);

        } finally {
            span.end();
        }
    }

    @Override
    public void delete(String objectKey) {
        Span span = tracer.spanBuilder("storage.delete").setAttribute("bucket", bucket)
                .setAttribute("object_key", objectKey).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build();

            s3Client.deleteObject(deleteRequest);

            LOG.warnf("DELETED object %s/%s (audit trail)", bucket, objectKey);

            recordMetrics("delete", System.currentTimeMillis() - startTime, true);
            span.setAttribute("delete_success", true);

        } catch (S3Exception e) {
            recordMetrics("delete", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("delete_success", false);
            LOG.errorf(e, "Failed to delete %s: %s", objectKey, errorMessage(e));
            throw new RuntimeException("Storage deletion failed: " + errorMessage(e), e);

        } finally {
            span.end();
        }
    }

    /**
     * Generates a pre-signed GET URL for temporary direct access to a private object.
     *
     * @param objectKey
     *            object to expose
     * @param ttlMinutes
     *            time-to-live in minutes
     * @return signed URL with embedded expiration
     */
    @Override
    public SignedUrlType generateSignedUrl(String objectKey, int ttlMinutes) {
        Span span = tracer.spanBuilder("storage.generate_signed_url").setAttribute("bucket", bucket)
                .setAttribute("ttl_minutes", ttlMinutes).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            Duration ttl = Duration.ofMinutes(ttlMinutes);

            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucket).key(objectKey).build();
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder().signatureDuration(ttl)
                    .getObjectRequest(getRequest).build();

            PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
            String url = presigned.url().toString();
            Instant expiresAt = Instant.now().plus(ttl);

            LOG.debugf("Generated signed URL for %s (expires in %d minutes)", objectKey, ttlMinutes);

            recordMetrics("signed_url", System.currentTimeMillis() - startTime, true);
            span.setAttribute("url_generated", true);

            return new SignedUrlType(url, expiresAt.toString(), ttlMinutes, objectKey);

        } catch (RuntimeException e) {
            recordMetrics("signed_url", System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            span.setAttribute("url_generated", false);
            LOG.errorf(e, "Failed to generate signed URL for %s", objectKey);
            throw new RuntimeException("Failed to generate signed URL: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    private void recordMetrics(String operation, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";
        Counter.builder("imagepipeline_storage_operations_total").tag("operation", operation).tag("status", status)
                .register(meterRegistry).increment();
        Timer.builder("imagepipeline_storage_duration").tag("operation", operation).register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));
    }

    private static String errorMessage(S3Exception e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
    }
}

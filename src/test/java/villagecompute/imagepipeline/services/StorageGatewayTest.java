/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URL;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;
import villagecompute.imagepipeline.api.types.SignedUrlType;
import villagecompute.imagepipeline.exceptions.ResourceNotFoundException;

/**
 * Unit tests for StorageGateway covering upload, download, delete, signed URL generation and error mapping.
 */
class StorageGatewayTest {

    private StorageGateway storageGateway;
    private S3Client s3Client;
    private S3Presigner s3Presigner;
    private Tracer tracer;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() throws Exception {
        s3Client = mock(S3Client.class);
        s3Presigner = mock(S3Presigner.class);
        meterRegistry = new SimpleMeterRegistry();
        tracer = OpenTelemetry.noop().getTracer("test");

        storageGateway = new StorageGateway();

        // Use reflection to inject mocked dependencies
        setField(storageGateway, "s3Client", s3Client);
        setField(storageGateway, "s3Presigner", s3Presigner);
        setField(storageGateway, "tracer", tracer);
        setField(storageGateway, "meterRegistry", meterRegistry);
        setField(storageGateway, "bucket", "image-pipeline");
    }

    /**
     * Test: Upload targets the configured bucket with the given key and content type.
     */
    @Test
    void testUpload_success() {
        byte[] testData = "test-image-data".getBytes();
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        storageGateway.upload("artifacts/abc.jpg", testData, "image/jpeg");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("image-pipeline", captor.getValue().bucket());
        assertEquals("artifacts/abc.jpg", captor.getValue().key());
        assertEquals("image/jpeg", captor.getValue().contentType());
        assertEquals(1.0, meterRegistry.get("imagepipeline_storage_operations_total").tag("operation", "upload")
                .tag("status", "success").counter().count());
    }

    /**
     * Test: Upload failure throws RuntimeException with descriptive message.
     */
    @Test
    void testUpload_failure() {
        S3Exception s3Exception = (S3Exception) S3Exception.builder().message("Access Denied").statusCode(403).build();
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(s3Exception);

        RuntimeException exception = assertThrows(RuntimeException.class,
                () -> storageGateway.upload("originals/1", "x".getBytes(), "image/png"));

        assertTrue(exception.getMessage().contains("Storage upload failed"));
        assertEquals(1.0, meterRegistry.get("imagepipeline_storage_operations_total").tag("operation", "upload")
                .tag("status", "failure").counter().count());
    }

    /**
     * Test: Successful download returns raw bytes.
     */
    @Test
    void testDownload_success() {
        byte[] testData = "test-image-data".getBytes();
        ResponseBytes<GetObjectResponse> responseBytes = ResponseBytes
                .fromByteArray(GetObjectResponse.builder().build(), testData);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenReturn(responseBytes);

        byte[] result = storageGateway.download("originals/1");

        assertArrayEquals(testData, result, "Downloaded data should match stored data");
    }

    /**
     * Test: Missing object maps to ResourceNotFoundException.
     */
    @Test
    void testDownload_missingObject() {
        NoSuchKeyException missing = NoSuchKeyException.builder().message("NoSuchKey").statusCode(404).build();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(missing);

        assertThrows(ResourceNotFoundException.class, () -> storageGateway.download("originals/missing"));
    }

    /**
     * Test: Other download failures throw RuntimeException.
     */
    @Test
    void testDownload_failure() {
        S3Exception s3Exception = (S3Exception) S3Exception.builder().message("Slow Down").statusCode(503).build();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenThrow(s3Exception);

        RuntimeException exception = assertThrows(RuntimeException.class,
                () -> storageGateway.download("originals/1"));

        assertTrue(exception.getMessage().contains("Storage download failed"));
    }

    /**
     * Test: Signed URL generation returns URL with correct TTL and expiry.
     */
    @Test
    void testGenerateSignedUrl_success() throws Exception {
        URL mockUrl = new URL("https://example.com/presigned-url?signature=xyz");
        PresignedGetObjectRequest presignedRequest = mock(PresignedGetObjectRequest.class);
        when(presignedRequest.url()).thenReturn(mockUrl);
        when(s3Presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presignedRequest);

        SignedUrlType result = storageGateway.generateSignedUrl("artifacts/abc.jpg", 60);

        assertNotNull(result);
        assertEquals(mockUrl.toString(), result.url());
        assertEquals(60, result.ttlMinutes());
        assertEquals("artifacts/abc.jpg", result.objectKey());
        assertTrue(Instant.parse(result.expiresAt()).isAfter(Instant.now()), "Expiry should be in the future");
    }

    /**
     * Test: Signed URL generation failure throws RuntimeException.
     */
    @Test
    void testGenerateSignedUrl_failure() {
        when(s3Presigner.presignGetObject(any(GetObjectPresignRequest.class)))
                .thenThrow(new RuntimeException("Presigner error"));

        RuntimeException exception = assertThrows(RuntimeException.class,
                () -> storageGateway.generateSignedUrl("artifacts/abc.jpg", 60));

        assertTrue(exception.getMessage().contains("Failed to generate signed URL"));
    }

    /**
     * Test: Delete operation succeeds.
     */
    @Test
    void testDelete_success() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenReturn(DeleteObjectResponse.builder().build());

        storageGateway.delete("originals/1");

        verify(s3Client).deleteObject(any(DeleteObjectRequest.class));
    }

    /**
     * Test: Delete failure throws RuntimeException.
     */
    @Test
    void testDelete_failure() {
        S3Exception s3Exception = (S3Exception) S3Exception.builder().message("Access Denied").statusCode(403).build();
        doThrow(s3Exception).when(s3Client).deleteObject(any(DeleteObjectRequest.class));

        assertThrows(RuntimeException.class, () -> storageGateway.delete("originals/1"));
    }

    /**
     * Helper method to set private fields via reflection.
     */
    private void setField(Object target, String fieldName, Object value) throws Exception {
        java.lang.reflect.Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}

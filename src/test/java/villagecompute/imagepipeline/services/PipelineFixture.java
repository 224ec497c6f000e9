/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import static villagecompute.imagepipeline.testing.TestFields.setField;

import java.awt.Color;
import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import villagecompute.imagepipeline.data.InMemoryMetadataStore;
import villagecompute.imagepipeline.jobs.TransformJobHandler;
import villagecompute.imagepipeline.observability.PipelineMetrics;
import villagecompute.imagepipeline.testing.InMemoryBlobStore;
import villagecompute.imagepipeline.testing.MutableClock;
import villagecompute.imagepipeline.transform.TransformExecutor;

/**
 * Hand-wired pipeline: real services over an in-memory blob store and metadata store.
 */
final class PipelineFixture implements AutoCloseable {

    final MutableClock clock = MutableClock.startingAt("2025-01-15T10:00:00Z");
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PipelineMetrics metrics = new PipelineMetrics(registry);
    final InMemoryBlobStore blobStore = new InMemoryBlobStore();
    final InMemoryMetadataStore metadataStore = new InMemoryMetadataStore();
    final FingerprintService fingerprintService = new FingerprintService();
    final TransformExecutor transformExecutor = new TransformExecutor(40_000_000L, Color.WHITE);
    final ArtifactCacheService cacheService = new ArtifactCacheService();
    final AdmissionControlService admissionControl = new AdmissionControlService();
    final TransformJobHandler handler = new TransformJobHandler();
    final TransformJobService jobService = new TransformJobService();
    final ImageCatalogService imageCatalog = new ImageCatalogService();
    final DeliveryService deliveryService = new DeliveryService();

    PipelineFixture(boolean cacheEnabled) {
        cacheService.metrics = metrics;
        cacheService.maxEntries = 1000;
        cacheService.maxBytes = 64L * 1024 * 1024;
        cacheService.enabled = cacheEnabled;
        cacheService.init();

        admissionControl.metrics = metrics;
        admissionControl.clock = clock;
        admissionControl.uploadBurst = 100;
        admissionControl.uploadRefillPerSecond = 10;
        admissionControl.transformBurst = 100;
        admissionControl.transformRefillPerSecond = 10;
        admissionControl.readBurst = 1000;
        admissionControl.readRefillPerSecond = 100;

        setField(handler, "blobStore", blobStore);
        setField(handler, "metadataStore", metadataStore);
        setField(handler, "transformExecutor", transformExecutor);
        setField(handler, "metrics", metrics);
        setField(handler, "tracer", OpenTelemetry.noop().getTracer("test"));
        setField(handler, "clock", clock);

        jobService.handler = handler;
        jobService.cacheService = cacheService;
        jobService.metadataStore = metadataStore;
        jobService.metrics = metrics;
        jobService.clock = clock;
        jobService.poolSize = 2;
        jobService.queueCapacity = 32;
        jobService.maxExecution = Duration.ofSeconds(20);
        jobService.retention = Duration.ofMinutes(10);
        jobService.observedRetention = Duration.ofMinutes(1);
        jobService.sweepInterval = Duration.ofHours(1);
        jobService.init();

        imageCatalog.blobStore = blobStore;
        imageCatalog.metadataStore = metadataStore;
        imageCatalog.fingerprintService = fingerprintService;
        imageCatalog.cacheService = cacheService;
        imageCatalog.admissionControl = admissionControl;
        imageCatalog.transformExecutor = transformExecutor;
        imageCatalog.clock = clock;

        deliveryService.imageCatalog = imageCatalog;
        deliveryService.admissionControl = admissionControl;
        deliveryService.fingerprintService = fingerprintService;
        deliveryService.cacheService = cacheService;
        deliveryService.jobService = jobService;
        deliveryService.transformExecutor = transformExecutor;
    }

    PipelineFixture() {
        this(true);
    }

    @Override
    public void close() {
        jobService.shutdown();
    }
}

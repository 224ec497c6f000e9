/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.data.MetadataStore;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.exceptions.TransformExecutionException;
import villagecompute.imagepipeline.observability.PipelineMetrics;
import villagecompute.imagepipeline.services.BlobStore;
import villagecompute.imagepipeline.transform.TransformExecutor;

/**
 * Worker-side processing of one transformation job.
 *
 * <p>
 * Workflow:
 * <ol>
 * <li>Download the original from blob storage</li>
 * <li>Resolve and download watermark overlays referenced by the spec</li>
 * <li>Run the {@link TransformExecutor}</li>
 * <li>Persist the encoded result under {@code artifacts/<fingerprint>.<ext>}</li>
 * </ol>
 *
 * <p>
 * Failures propagate to the caller, which records them on the job. Nothing is retried here.
 */
@ApplicationScoped
public class TransformJobHandler {

    private static final Logger LOG = Logger.getLogger(TransformJobHandler.class);

    static final String ARTIFACT_PREFIX = "artifacts/";

    @Inject
    BlobStore blobStore;

    @Inject
    MetadataStore metadataStore;

    @Inject
    TransformExecutor transformExecutor;

    @Inject
    PipelineMetrics metrics;

    @Inject
    Tracer tracer;

    Clock clock = Clock.systemUTC();

    /**
     * Produces the artifact for a job.
     *
     * @param jobId
     *            job identifier, for tracing and logs
     * @param request
     *            validated job request
     * @return the persisted artifact
     * @throws TransformExecutionException
     *             if the source cannot be processed
     * @throws villagecompute.imagepipeline.exceptions.ValidationException
     *             if the spec does not fit the decoded source
     */
    public Artifact execute(String jobId, JobRequest request) {
        ImageRecord source = request.source();
        Span span = tracer.spanBuilder("job.execute").setAttribute("job_id", jobId)
                .setAttribute("image_id", source.id()).setAttribute("fingerprint", request.fingerprint().value())
                .setAttribute("operations", request.spec().operations().size()).startSpan();

        Timer.Sample sample = Timer.start(metrics.getRegistry());
        boolean success = false;

        try (Scope scope = span.makeCurrent()) {
            LOG.infof("Processing job %s: image=%s spec=[%s] format=%s", jobId, source.id(), request.spec(),
                    request.format().canonicalName());

            byte[] sourceBytes = blobStore.download(source.storageKey());
            if (sourceBytes == null || sourceBytes.length == 0) {
                throw new TransformExecutionException("Source object is empty: " + source.storageKey());
            }

            Map<String, byte[]> overlays = loadOverlays(request);

            TransformExecutor.TransformResult result = transformExecutor.execute(sourceBytes, request.spec(),
                    request.format(), overlays);

            String objectKey = ARTIFACT_PREFIX + request.fingerprint().value() + "." + result.format().extension();
            blobStore.upload(objectKey, result.data(), result.format().mimeType());

            Artifact artifact = new Artifact(request.fingerprint(), result.data(), result.format(), result.width(),
                    result.height(), objectKey, Instant.now(clock));

            LOG.infof("Job %s produced %dx%d %s (%d bytes)", jobId, artifact.width(), artifact.height(),
                    artifact.format().canonicalName(), artifact.sizeBytes());
            span.setAttribute("size_bytes", artifact.sizeBytes());
            success = true;
            return artifact;

        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;

        } finally {
            span.setAttribute("success", success);
            sample.stop(metrics.transformTimer(success ? "success" : "failure"));
            span.end();
        }
    }

    private Map<String, byte[]> loadOverlays(JobRequest request) {
        Map<String, byte[]> overlays = new LinkedHashMap<>();
        for (String overlayId : request.spec().overlayReferences()) {
            ImageRecord overlay = metadataStore.findImage(overlayId).orElseThrow(
                    () -> new TransformExecutionException("Overlay image no longer exists: " + overlayId));
            overlays.put(overlayId, blobStore.download(overlay.storageKey()));
        }
        return overlays;
    }
}

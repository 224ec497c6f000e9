/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.time.Duration;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.data.models.ImageRecord;
import villagecompute.imagepipeline.exceptions.CacheUnavailableException;
import villagecompute.imagepipeline.exceptions.ResourceNotFoundException;
import villagecompute.imagepipeline.exceptions.ValidationException;
import villagecompute.imagepipeline.jobs.JobHandle;
import villagecompute.imagepipeline.jobs.JobRequest;
import villagecompute.imagepipeline.jobs.JobStatusSnapshot;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.services.AdmissionControlService.ActionClass;
import villagecompute.imagepipeline.services.AdmissionControlService.AdmissionDecision;
import villagecompute.imagepipeline.transform.Dimensions;
import villagecompute.imagepipeline.transform.OutputFormat;
import villagecompute.imagepipeline.transform.TransformExecutor;
import villagecompute.imagepipeline.transform.TransformSpec;

/**
 * Entry point for transformation and delivery requests.
 *
 * <p>
 * Submissions pass the same gates in order:
 * <ol>
 * <li>Authentication (anonymous callers are rejected before admission control)</li>
 * <li>Admission control for the request's action class ({@link #resolve} charges once its outcome is known)</li>
 * <li>Image lookup and ownership check, including watermark overlays</li>
 * <li>Spec validation against the source dimensions and pixel budget</li>
 * <li>Fingerprint, cache lookup, and on a miss a job submit</li>
 * </ol>
 *
 * <p>
 * No pixel work happens on the calling thread. Cache failures are absorbed: the request proceeds as a miss and the job
 * result is still delivered through the job status.
 */
@ApplicationScoped
public class DeliveryService {

    private static final Logger LOG = Logger.getLogger(DeliveryService.class);

    @Inject
    ImageCatalogService imageCatalog;

    @Inject
    AdmissionControlService admissionControl;

    @Inject
    FingerprintService fingerprintService;

    @Inject
    ArtifactCacheService cacheService;

    @Inject
    TransformJobService jobService;

    @Inject
    TransformExecutor transformExecutor;

    /**
     * Requests a transformation of an image.
     *
     * @param imageId
     *            source image
     * @param spec
     *            operations to apply
     * @param requestedFormat
     *            output encoding, null for the source's own
     * @param identity
     *            caller
     * @return the cached artifact, or a handle to the job producing it
     * @throws ValidationException
     *             if the spec does not fit the source
     * @throws villagecompute.imagepipeline.exceptions.ThrottledException
     *             if the caller's transform budget or the worker queue is exhausted
     */
    public DeliveryResult submitTransform(String imageId, TransformSpec spec, OutputFormat requestedFormat,
            RequestIdentity identity) {
        authenticate(identity, imageId);
        AdmissionDecision admission = admissionControl.enforce(identity, ActionClass.TRANSFORM);
        ImageRecord image = loadOwned(imageId, identity);
        return transform(image, spec, requestedFormat, identity, admission.remaining());
    }

    /**
     * Resolves an image reference. Without a spec (and without a format change) the original is returned; otherwise
     * the transformed artifact is served from cache or produced by a job.
     *
     * <p>
     * Each call is charged exactly once, against the class of work it turns out to need: READ when the original or a
     * cached artifact is delivered, TRANSFORM when a job has to be submitted. A throttled call therefore spends no
     * token. The lookups done before charging touch only metadata and the cache.
     */
    public DeliveryResult resolve(String imageId, TransformSpec spec, OutputFormat requestedFormat,
            RequestIdentity identity) {
        authenticate(identity, imageId);
        ImageRecord image = loadOwned(imageId, identity);

        TransformSpec effectiveSpec = spec == null ? TransformSpec.empty() : spec;
        if (effectiveSpec.isEmpty()
                && (requestedFormat == null || requestedFormat == imageCatalog.defaultFormat(image))) {
            AdmissionDecision admission = admissionControl.enforce(identity, ActionClass.READ);
            return DeliveryResult.original(image, admission.remaining());
        }

        Prepared prepared = prepare(image, effectiveSpec, requestedFormat, identity);
        Optional<Artifact> cached = lookup(prepared.fingerprint());
        if (cached.isPresent()) {
            AdmissionDecision admission = admissionControl.enforce(identity, ActionClass.READ);
            LOG.debugf("Resolved %s from cache (%s)", imageId, prepared.fingerprint().shortValue());
            return DeliveryResult.ready(image, cached.get(), admission.remaining());
        }

        AdmissionDecision admission = admissionControl.enforce(identity, ActionClass.TRANSFORM);
        JobHandle handle = jobService.submit(prepared.request());
        return DeliveryResult.pending(image, handle, admission.remaining());
    }

    /**
     * Current status of a job. Polling is charged against the caller's read budget.
     */
    public JobStatusSnapshot jobStatus(String jobId, RequestIdentity identity) {
        identity.requireAuthenticated();
        LoggingConfig.setJobId(jobId);
        admissionControl.enforce(identity, ActionClass.READ);
        return jobService.status(jobId);
    }

    /**
     * Waits up to {@code timeout} for a job to finish.
     */
    public JobStatusSnapshot awaitJob(String jobId, Duration timeout, RequestIdentity identity) {
        identity.requireAuthenticated();
        LoggingConfig.setJobId(jobId);
        admissionControl.enforce(identity, ActionClass.READ);
        return jobService.await(jobId, timeout);
    }

    /**
     * Cancels a queued job on behalf of the user that submitted it.
     */
    public JobStatusSnapshot cancelJob(String jobId, RequestIdentity identity) {
        identity.requireAuthenticated();
        LoggingConfig.setJobId(jobId);
        admissionControl.enforce(identity, ActionClass.TRANSFORM);
        JobStatusSnapshot snapshot = jobService.status(jobId);
        ImageRecord image = imageCatalog.get(snapshot.imageId());
        identity.requireOwnerOf(image);
        return jobService.cancel(jobId);
    }

    private DeliveryResult transform(ImageRecord image, TransformSpec spec, OutputFormat requestedFormat,
            RequestIdentity identity, long remaining) {
        if (spec == null) {
            throw new ValidationException("Transform spec is required");
        }
        Prepared prepared = prepare(image, spec, requestedFormat, identity);

        Optional<Artifact> cached = lookup(prepared.fingerprint());
        if (cached.isPresent()) {
            LOG.debugf("Cache hit for %s on image %s", prepared.fingerprint().shortValue(), image.id());
            return DeliveryResult.ready(image, cached.get(), remaining);
        }

        JobHandle handle = jobService.submit(prepared.request());
        return DeliveryResult.pending(image, handle, remaining);
    }

    private Prepared prepare(ImageRecord image, TransformSpec spec, OutputFormat requestedFormat,
            RequestIdentity identity) {
        for (String overlayId : spec.overlayReferences()) {
            ImageRecord overlay;
            try {
                overlay = imageCatalog.get(overlayId);
            } catch (ResourceNotFoundException e) {
                throw new ValidationException("Unknown watermark overlay: " + overlayId, e);
            }
            identity.requireOwnerOf(overlay);
        }

        OutputFormat format = spec
                .effectiveFormat(requestedFormat != null ? requestedFormat : imageCatalog.defaultFormat(image));
        spec.plan(new Dimensions(image.width(), image.height()), transformExecutor.getMaxPixels());

        Fingerprint fingerprint = fingerprintService.compute(image.contentHash(), spec, format);
        LoggingConfig.setFingerprint(fingerprint.value());
        return new Prepared(fingerprint, new JobRequest(image, spec, format, identity.userId(), fingerprint));
    }

    private Optional<Artifact> lookup(Fingerprint fingerprint) {
        try {
            return cacheService.get(fingerprint);
        } catch (CacheUnavailableException e) {
            LOG.debugf("Cache lookup skipped for %s: %s", fingerprint.shortValue(), e.getMessage());
            return Optional.empty();
        }
    }

    private void authenticate(RequestIdentity identity, String imageId) {
        identity.requireAuthenticated();
        LoggingConfig.setUserId(identity.userId());
        LoggingConfig.setImageId(imageId);
    }

    private ImageRecord loadOwned(String imageId, RequestIdentity identity) {
        ImageRecord image = imageCatalog.get(imageId);
        identity.requireOwnerOf(image);
        return image;
    }

    private record Prepared(Fingerprint fingerprint, JobRequest request) {
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Gauge;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.imagepipeline.data.MetadataStore;
import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;
import villagecompute.imagepipeline.data.models.JobRecord;
import villagecompute.imagepipeline.exceptions.CacheUnavailableException;
import villagecompute.imagepipeline.exceptions.JobTimeoutException;
import villagecompute.imagepipeline.exceptions.ResourceNotFoundException;
import villagecompute.imagepipeline.exceptions.ThrottledException;
import villagecompute.imagepipeline.exceptions.ValidationException;
import villagecompute.imagepipeline.jobs.JobError;
import villagecompute.imagepipeline.jobs.JobErrorCode;
import villagecompute.imagepipeline.jobs.JobHandle;
import villagecompute.imagepipeline.jobs.JobRequest;
import villagecompute.imagepipeline.jobs.JobState;
import villagecompute.imagepipeline.jobs.JobStatusSnapshot;
import villagecompute.imagepipeline.jobs.TransformJob;
import villagecompute.imagepipeline.jobs.TransformJobHandler;
import villagecompute.imagepipeline.observability.LoggingConfig;
import villagecompute.imagepipeline.observability.PipelineMetrics;

/**
 * Job registry and bounded worker pool for transformations.
 *
 * <p>
 * <b>Single-flight:</b> at most one non-terminal job exists per fingerprint. A submit for a fingerprint that already
 * has a queued or running job returns a handle to that job, so all callers observe the same terminal outcome.
 *
 * <p>
 * <b>Workers:</b> a fixed pool of {@code imagepipeline.workers.pool-size} threads drains a bounded queue of
 * {@code imagepipeline.workers.queue-capacity} jobs. A full queue rejects the submit with a {@link ThrottledException}.
 * On success the artifact is registered with the cache before the job is marked succeeded. Failures are recorded on
 * the job and never retried.
 *
 * <p>
 * <b>Timeouts:</b> a watchdog fails jobs running longer than {@code imagepipeline.jobs.max-execution} with
 * {@link JobErrorCode#TIMEOUT} and interrupts the worker, which stops at the next operation boundary.
 *
 * <p>
 * <b>Retention:</b> terminal jobs stay queryable for {@code imagepipeline.jobs.retention}, or for
 * {@code imagepipeline.jobs.observed-retention} once a status call has returned the terminal state, then are swept.
 *
 * <p>
 * <b>Thread Safety:</b> the registry maps are concurrent; job state transitions are atomic on the job itself.
 */
@ApplicationScoped
public class TransformJobService {

    private static final Logger LOG = Logger.getLogger(TransformJobService.class);

    @Inject
    TransformJobHandler handler;

    @Inject
    ArtifactCacheService cacheService;

    @Inject
    MetadataStore metadataStore;

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "imagepipeline.workers.pool-size",
            defaultValue = "4")
    int poolSize;

    @ConfigProperty(
            name = "imagepipeline.workers.queue-capacity",
            defaultValue = "256")
    int queueCapacity;

    @ConfigProperty(
            name = "imagepipeline.jobs.max-execution",
            defaultValue = "PT60S")
    Duration maxExecution;

    @ConfigProperty(
            name = "imagepipeline.jobs.retention",
            defaultValue = "PT10M")
    Duration retention;

    @ConfigProperty(
            name = "imagepipeline.jobs.observed-retention",
            defaultValue = "PT1M")
    Duration observedRetention;

    @ConfigProperty(
            name = "imagepipeline.jobs.sweep-interval",
            defaultValue = "PT30S")
    Duration sweepInterval;

    Clock clock = Clock.systemUTC();

    private final ConcurrentMap<String, TransformJob> jobsById = new ConcurrentHashMap<>();

    private final ConcurrentMap<Fingerprint, TransformJob> inFlight = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, Runnable> queuedTasks = new ConcurrentHashMap<>();

    private final AtomicInteger activeWorkers = new AtomicInteger();

    private ThreadPoolExecutor executor;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void init() {
        executor = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), namedThreadFactory("transform-worker"));
        scheduler = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("transform-job-watchdog"));
        scheduler.scheduleWithFixedDelay(this::sweepSafely, sweepInterval.toMillis(), sweepInterval.toMillis(),
                TimeUnit.MILLISECONDS);

        Gauge.builder("imagepipeline_jobs_queue_depth", this, TransformJobService::queueDepth)
                .description("Transformation jobs waiting for a worker").register(metrics.getRegistry());
        Gauge.builder("imagepipeline_jobs_active_workers", this, TransformJobService::activeWorkers)
                .description("Workers currently executing a transformation").register(metrics.getRegistry());

        LOG.infof("Initialized TransformJobService (poolSize=%d, queueCapacity=%d, maxExecution=%s)", poolSize,
                queueCapacity, maxExecution);
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down transformation workers");
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Submits a transformation, or attaches to the in-flight job for the same fingerprint.
     *
     * @param request
     *            validated request
     * @return handle to the new or existing job
     * @throws ThrottledException
     *             if the worker queue is full
     */
    public JobHandle submit(JobRequest request) {
        Fingerprint fingerprint = request.fingerprint();
        AtomicBoolean created = new AtomicBoolean();
        TransformJob job = inFlight.compute(fingerprint, (key, existing) -> {
            if (existing != null && !existing.state().isTerminal()) {
                return existing;
            }
            created.set(true);
            TransformJob fresh = new TransformJob(UUID.randomUUID().toString(), request, clock.instant());
            jobsById.put(fresh.id(), fresh);
            return fresh;
        });

        if (!created.get()) {
            LOG.debugf("Attached to in-flight job %s for fingerprint %s", job.id(), fingerprint.shortValue());
            return new JobHandle(job.id(), fingerprint, true);
        }

        persist(job);
        metrics.incrementJobState(JobState.QUEUED.wireName());

        Runnable task = () -> runJob(job);
        queuedTasks.put(job.id(), task);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            queuedTasks.remove(job.id());
            job.fail(new JobError(JobErrorCode.EXECUTION_ERROR, "Worker queue is full"), clock.instant());
            inFlight.remove(fingerprint, job);
            persist(job);
            metrics.incrementJobState(JobState.FAILED.wireName());
            LOG.warnf("Rejected job %s: worker queue full (%d queued)", job.id(), queueDepth());
            throw new ThrottledException("Transformation queue is full, retry later", 1, "queue");
        }

        LOG.infof("Queued job %s for image %s (fingerprint %s)", job.id(), request.source().id(),
                fingerprint.shortValue());
        return new JobHandle(job.id(), fingerprint, false);
    }

    /**
     * Returns the current state of a job. A terminal state returned here counts as observed.
     *
     * @throws ResourceNotFoundException
     *             if the job is unknown or already reclaimed
     */
    public JobStatusSnapshot status(String jobId) {
        TransformJob job = requireJob(jobId);
        JobStatusSnapshot snapshot = job.snapshot();
        if (snapshot.isTerminal()) {
            job.markObserved(clock.instant());
        }
        return snapshot;
    }

    public Optional<JobStatusSnapshot> find(String jobId) {
        return Optional.ofNullable(jobId == null ? null : jobsById.get(jobId)).map(TransformJob::snapshot);
    }

    /**
     * Blocks until the job reaches a terminal state or the timeout elapses, whichever comes first.
     *
     * @param jobId
     *            job to wait for
     * @param timeout
     *            longest time to block, must not be negative
     * @return terminal snapshot, or the latest snapshot if the timeout elapsed
     */
    public JobStatusSnapshot await(String jobId, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new ValidationException("Wait timeout must be zero or positive");
        }
        TransformJob job = requireJob(jobId);
        try {
            job.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.debugf("Wait for job %s timed out after %dms", jobId, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debugf("Wait for job %s interrupted", jobId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job completion failed unexpectedly: " + jobId, e);
        }
        return status(jobId);
    }

    /**
     * Cancels a queued job. Running jobs are left to finish and their artifact is cached as usual.
     *
     * @return snapshot after the cancellation attempt
     * @throws ResourceNotFoundException
     *             if the job is unknown
     */
    public JobStatusSnapshot cancel(String jobId) {
        TransformJob job = requireJob(jobId);
        if (job.cancel(clock.instant())) {
            Runnable task = queuedTasks.remove(jobId);
            if (task != null) {
                executor.remove(task);
            }
            inFlight.remove(job.fingerprint(), job);
            persist(job);
            metrics.incrementJobState(JobState.CANCELLED.wireName());
            LOG.infof("Cancelled queued job %s", jobId);
        } else {
            LOG.infof("Cancel of job %s not applied, job is %s", jobId, job.state());
        }
        return job.snapshot();
    }

    /**
     * Reclaims terminal jobs whose retention has elapsed.
     *
     * @return number of jobs reclaimed
     */
    public int sweep() {
        Instant now = clock.instant();
        int reclaimed = 0;
        for (TransformJob job : jobsById.values()) {
            if (!job.state().isTerminal()) {
                continue;
            }
            Instant observedAt = job.observedAt();
            Instant finishedAt = job.finishedAt();
            boolean expired = (observedAt != null && !now.isBefore(observedAt.plus(observedRetention)))
                    || (finishedAt != null && !now.isBefore(finishedAt.plus(retention)));
            if (expired && jobsById.remove(job.id(), job)) {
                metadataStore.deleteJob(job.id());
                reclaimed++;
            }
        }
        if (reclaimed > 0) {
            LOG.debugf("Reclaimed %d terminal jobs", reclaimed);
        }
        return reclaimed;
    }

    public int queueDepth() {
        return executor == null ? 0 : executor.getQueue().size();
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public int trackedJobs() {
        return jobsById.size();
    }

    private void runJob(TransformJob job) {
        queuedTasks.remove(job.id());
        if (!job.start(Thread.currentThread(), clock.instant())) {
            LOG.debugf("Skipping job %s, already %s", job.id(), job.state());
            return;
        }

        activeWorkers.incrementAndGet();
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(job.id());
        LoggingConfig.setImageId(job.request().source().id());
        LoggingConfig.setFingerprint(job.fingerprint().value());
        persist(job);
        metrics.incrementJobState(JobState.RUNNING.wireName());

        ScheduledFuture<?> watchdog = scheduler.schedule(() -> timeOut(job), maxExecution.toMillis(),
                TimeUnit.MILLISECONDS);
        try {
            Artifact artifact = handler.execute(job.id(), job.request());
            cacheArtifact(job, artifact);
            if (job.succeed(artifact, clock.instant())) {
                metrics.incrementJobState(JobState.SUCCEEDED.wireName());
                LOG.infof("Job %s succeeded", job.id());
            } else {
                LOG.warnf("Job %s finished after reaching %s, result kept in cache", job.id(), job.state());
            }
        } catch (ValidationException e) {
            failJob(job, JobErrorCode.VALIDATION_ERROR, e);
        } catch (RuntimeException e) {
            failJob(job, JobErrorCode.EXECUTION_ERROR, e);
        } catch (Error e) {
            // jobs end terminal whatever the handler throws
            failJob(job, JobErrorCode.EXECUTION_ERROR, e);
        } finally {
            watchdog.cancel(false);
            job.releaseWorker();
            // clears a watchdog interrupt that landed after the handler returned
            Thread.interrupted();
            inFlight.remove(job.fingerprint(), job);
            persist(job);
            activeWorkers.decrementAndGet();
            LoggingConfig.clearMDC();
        }
    }

    private void failJob(TransformJob job, JobErrorCode code, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (job.fail(new JobError(code, message), clock.instant())) {
            metrics.incrementJobState(JobState.FAILED.wireName());
            LOG.errorf(cause, "Job %s failed (%s)", job.id(), code);
        } else {
            LOG.debugf("Job %s already %s, ignoring late failure: %s", job.id(), job.state(), message);
        }
    }

    private void timeOut(TransformJob job) {
        JobTimeoutException timeout = new JobTimeoutException(job.id(), maxExecution);
        if (job.timeOut(new JobError(JobErrorCode.TIMEOUT, timeout.getMessage()), clock.instant())) {
            inFlight.remove(job.fingerprint(), job);
            persist(job);
            metrics.incrementJobState(JobState.FAILED.wireName());
            LOG.warnf("Job %s timed out after %dms, worker interrupted", job.id(), maxExecution.toMillis());
        }
    }

    private void cacheArtifact(TransformJob job, Artifact artifact) {
        try {
            cacheService.put(artifact, job.request().source().contentHash());
        } catch (CacheUnavailableException e) {
            LOG.debugf("Artifact for job %s not cached: %s", job.id(), e.getMessage());
        }
    }

    private void persist(TransformJob job) {
        JobStatusSnapshot snapshot = job.snapshot();
        JobRecord record = new JobRecord(snapshot.jobId(), snapshot.imageId(), snapshot.fingerprint().value(),
                job.request().requesterId(), snapshot.state(),
                snapshot.error() == null ? null : snapshot.error().code().name(),
                snapshot.error() == null ? null : snapshot.error().message(), snapshot.enqueuedAt(),
                clock.instant());
        metadataStore.saveJob(record);
    }

    private TransformJob requireJob(String jobId) {
        TransformJob job = jobId == null ? null : jobsById.get(jobId);
        if (job == null) {
            throw new ResourceNotFoundException("Job not found: " + jobId);
        }
        return job;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job sweep failed");
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import villagecompute.imagepipeline.data.models.Artifact;
import villagecompute.imagepipeline.data.models.Fingerprint;

/**
 * Mutable job record owned by the job registry.
 *
 * <p>
 * Every transition is a compare-and-set on the current state under the job's monitor, so a worker finishing and the
 * watchdog timing out race safely: whichever transition lands first wins and the other is a no-op. The first terminal
 * transition completes {@link #completion()}, which is how blocked waiters are released.
 */
public final class TransformJob {

    private final String id;
    private final JobRequest request;
    private final Instant enqueuedAt;
    private final CompletableFuture<JobStatusSnapshot> completion = new CompletableFuture<>();

    private JobState state = JobState.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant observedAt;
    private Artifact artifact;
    private JobError error;
    private Thread worker;

    public TransformJob(String id, JobRequest request, Instant enqueuedAt) {
        this.id = id;
        this.request = request;
        this.enqueuedAt = enqueuedAt;
    }

    public String id() {
        return id;
    }

    public JobRequest request() {
        return request;
    }

    public Fingerprint fingerprint() {
        return request.fingerprint();
    }

    public CompletableFuture<JobStatusSnapshot> completion() {
        return completion;
    }

    public synchronized JobState state() {
        return state;
    }

    /**
     * Claims the job for a worker thread.
     *
     * @return false if the job is no longer queued
     */
    public synchronized boolean start(Thread workerThread, Instant now) {
        if (state != JobState.QUEUED) {
            return false;
        }
        state = JobState.RUNNING;
        startedAt = now;
        worker = workerThread;
        return true;
    }

    public synchronized boolean succeed(Artifact result, Instant now) {
        if (state != JobState.RUNNING) {
            return false;
        }
        state = JobState.SUCCEEDED;
        artifact = result;
        return finish(now);
    }

    public synchronized boolean fail(JobError failure, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        state = JobState.FAILED;
        error = failure;
        return finish(now);
    }

    /**
     * Cancels a job that no worker has claimed yet.
     *
     * @return false if the job already started or finished
     */
    public synchronized boolean cancel(Instant now) {
        if (state != JobState.QUEUED) {
            return false;
        }
        state = JobState.CANCELLED;
        return finish(now);
    }

    /**
     * Fails a running job that exceeded its budget and interrupts its worker.
     *
     * @return false if the job is not running
     */
    public synchronized boolean timeOut(JobError failure, Instant now) {
        if (state != JobState.RUNNING) {
            return false;
        }
        state = JobState.FAILED;
        error = failure;
        if (worker != null) {
            worker.interrupt();
        }
        return finish(now);
    }

    /**
     * Detaches the worker thread once it stops touching this job.
     */
    public synchronized void releaseWorker() {
        worker = null;
    }

    /**
     * Records that a requester saw the terminal state.
     */
    public synchronized void markObserved(Instant now) {
        if (state.isTerminal() && observedAt == null) {
            observedAt = now;
        }
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized Instant observedAt() {
        return observedAt;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized JobStatusSnapshot snapshot() {
        return new JobStatusSnapshot(id, request.source().id(), request.fingerprint(), state, artifact, error,
                enqueuedAt, startedAt, finishedAt);
    }

    private boolean finish(Instant now) {
        finishedAt = now;
        completion.complete(snapshot());
        return true;
    }
}

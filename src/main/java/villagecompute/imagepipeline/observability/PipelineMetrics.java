/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.observability;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Counters and timers shared by the pipeline services.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code imagepipeline_cache_requests_total{result}} - Cache lookups (hit, miss, unavailable)</li>
 * <li><b>Counters:</b> {@code imagepipeline_jobs_total{state}} - Job transitions into each state</li>
 * <li><b>Counters:</b> {@code imagepipeline_admission_checks_total{action,result}} - Admission decisions</li>
 * <li><b>Timers:</b> {@code imagepipeline_transform_duration{status}} - Worker execution time</li>
 * </ul>
 *
 * <p>
 * Gauges (queue depth, active workers, cache entries and bytes) are registered by the services that own the measured
 * state. Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class PipelineMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    PipelineMetrics() {
    }

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @param result
     *            "hit", "miss" or "unavailable"
     */
    public void incrementCacheRequest(String result) {
        counter("imagepipeline_cache_requests_total", "Artifact cache lookups", "result", result).increment();
    }

    public void incrementJobState(String state) {
        counter("imagepipeline_jobs_total", "Transformation job state transitions", "state", state).increment();
    }

    public void incrementAdmissionCheck(String action, boolean allowed) {
        String key = "imagepipeline_admission_checks_total:" + action + ":" + allowed;
        counters.computeIfAbsent(key,
                k -> Counter.builder("imagepipeline_admission_checks_total").description("Admission control decisions")
                        .tag("action", action).tag("result", allowed ? "allowed" : "throttled").register(registry))
                .increment();
    }

    /**
     * Timer for worker execution, used with {@link Timer.Sample#stop(Timer)}.
     *
     * @param status
     *            "success" or "failure"
     */
    public Timer transformTimer(String status) {
        return Timer.builder("imagepipeline_transform_duration").description("Transformation job execution time")
                .tag("status", status).register(registry);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + ":" + tagValue,
                k -> Counter.builder(name).description(description).tag(tagKey, tagValue).register(registry));
    }
}

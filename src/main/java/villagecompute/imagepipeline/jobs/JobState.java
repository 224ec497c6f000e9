/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.jobs;

import java.util.Locale;

/**
 * Lifecycle of a transformation job.
 *
 * <pre>
 * QUEUED -&gt; RUNNING -&gt; SUCCEEDED
 * QUEUED -&gt; RUNNING -&gt; FAILED
 * QUEUED -&gt; CANCELLED
 * </pre>
 */
public enum JobState {
    QUEUED, RUNNING, SUCCEEDED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import villagecompute.imagepipeline.testing.InMemoryBlobStore;

/**
 * Replaces the S3 gateway in {@code @QuarkusTest} runs.
 */
@Alternative
@Priority(1)
@ApplicationScoped
public class InMemoryBlobStoreBean extends InMemoryBlobStore {
}

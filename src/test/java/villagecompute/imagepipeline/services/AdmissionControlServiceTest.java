/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.imagepipeline.exceptions.ThrottledException;
import villagecompute.imagepipeline.observability.PipelineMetrics;
import villagecompute.imagepipeline.services.AdmissionControlService.ActionClass;
import villagecompute.imagepipeline.services.AdmissionControlService.AdmissionDecision;
import villagecompute.imagepipeline.testing.MutableClock;

/**
 * Unit tests for AdmissionControlService token buckets.
 */
class AdmissionControlServiceTest {

    private AdmissionControlService admission;
    private MutableClock clock;
    private SimpleMeterRegistry registry;

    private final RequestIdentity alice = RequestIdentity.user("alice", "10.0.0.1");
    private final RequestIdentity bob = RequestIdentity.user("bob", "10.0.0.1");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = MutableClock.startingAt("2025-01-15T10:00:00Z");

        admission = new AdmissionControlService();
        admission.metrics = new PipelineMetrics(registry);
        admission.clock = clock;
        admission.uploadBurst = 2;
        admission.uploadRefillPerSecond = 0.1;
        admission.transformBurst = 3;
        admission.transformRefillPerSecond = 0.5;
        admission.readBurst = 10;
        admission.readRefillPerSecond = 5;
    }

    @Test
    void testBurstAllowed_thenThrottledWithRetryAfter() {
        for (int i = 0; i < 3; i++) {
            AdmissionDecision decision = admission.check(alice, ActionClass.TRANSFORM);
            assertTrue(decision.allowed(), "Request " + (i + 1) + " should be allowed");
            assertEquals(2 - i, decision.remaining());
        }

        ThrottledException e = assertThrows(ThrottledException.class,
                () -> admission.enforce(alice, ActionClass.TRANSFORM));

        assertEquals(2, e.getRetryAfterSeconds());
        assertEquals("transform:u:alice", e.getBucketKey());
    }

    @Test
    void testThrottledRequest_succeedsAfterWaiting() {
        for (int i = 0; i < 3; i++) {
            admission.enforce(alice, ActionClass.TRANSFORM);
        }
        assertFalse(admission.allow(alice, ActionClass.TRANSFORM));

        clock.advance(Duration.ofSeconds(2));

        assertTrue(admission.allow(alice, ActionClass.TRANSFORM));
        assertFalse(admission.allow(alice, ActionClass.TRANSFORM));
    }

    @Test
    void testRefill_neverExceedsBurst() {
        admission.enforce(alice, ActionClass.TRANSFORM);

        clock.advance(Duration.ofHours(1));

        assertEquals(3, admission.remaining(alice, ActionClass.TRANSFORM));
    }

    @Test
    void testIdentitiesHaveIndependentBuckets() {
        for (int i = 0; i < 3; i++) {
            admission.enforce(alice, ActionClass.TRANSFORM);
        }

        assertFalse(admission.allow(alice, ActionClass.TRANSFORM));
        assertTrue(admission.allow(bob, ActionClass.TRANSFORM));
    }

    @Test
    void testActionClassesHaveIndependentBuckets() {
        admission.enforce(alice, ActionClass.UPLOAD);
        admission.enforce(alice, ActionClass.UPLOAD);

        assertFalse(admission.allow(alice, ActionClass.UPLOAD));
        assertTrue(admission.allow(alice, ActionClass.READ));
        assertTrue(admission.allow(alice, ActionClass.TRANSFORM));
    }

    @Test
    void testAnonymousCallersKeyedByAddress() {
        RequestIdentity first = RequestIdentity.anonymous("192.168.1.5");
        RequestIdentity sameAddress = RequestIdentity.anonymous("192.168.1.5");
        RequestIdentity otherAddress = RequestIdentity.anonymous("192.168.1.6");

        admission.enforce(first, ActionClass.UPLOAD);
        admission.enforce(sameAddress, ActionClass.UPLOAD);

        assertFalse(admission.allow(first, ActionClass.UPLOAD));
        assertTrue(admission.allow(otherAddress, ActionClass.UPLOAD));
    }

    @Test
    void testRetryAfter_roundsUpToWholeSeconds() {
        admission.enforce(alice, ActionClass.UPLOAD);
        admission.enforce(alice, ActionClass.UPLOAD);

        AdmissionDecision decision = admission.check(alice, ActionClass.UPLOAD);

        assertFalse(decision.allowed());
        assertEquals(10, decision.retryAfterSeconds());
        assertEquals(0, decision.remaining());
    }

    @Test
    void testRemaining_doesNotCharge() {
        assertEquals(10, admission.remaining(alice, ActionClass.READ));
        assertEquals(10, admission.remaining(alice, ActionClass.READ));

        admission.enforce(alice, ActionClass.READ);

        assertEquals(9, admission.remaining(alice, ActionClass.READ));
    }

    @Test
    void testReset_restoresFullBuckets() {
        for (int i = 0; i < 3; i++) {
            admission.enforce(alice, ActionClass.TRANSFORM);
        }

        admission.reset();

        assertTrue(admission.allow(alice, ActionClass.TRANSFORM));
    }

    @Test
    void testDecisionsCounted() {
        admission.enforce(alice, ActionClass.UPLOAD);
        admission.enforce(alice, ActionClass.UPLOAD);
        admission.allow(alice, ActionClass.UPLOAD);

        assertEquals(2.0, registry.get("imagepipeline_admission_checks_total").tag("action", "upload")
                .tag("result", "allowed").counter().count());
        assertEquals(1.0, registry.get("imagepipeline_admission_checks_total").tag("action", "upload")
                .tag("result", "throttled").counter().count());
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.dnsmate.domain.model.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {
    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        breaker = new CircuitBreaker(5, Duration.ofSeconds(60), clock);
    }

    @Test
    void startsClosed() {
        assertEquals(CircuitState.CLOSED, breaker.state());
        assertTrue(breaker.canExecute());
        assertEquals(0, breaker.failureCount());
    }

    @Test
    void opensAtThresholdAndStaysOpenOnFurtherFailures() {
        for (int i = 0; i < 4; i++) {
            breaker.recordFailure();
        }
        assertTrue(breaker.canExecute());
        assertEquals(CircuitState.CLOSED, breaker.state());

        breaker.recordFailure();
        assertFalse(breaker.canExecute());
        assertEquals(CircuitState.OPEN, breaker.state());

        breaker.recordFailure();
        assertFalse(breaker.canExecute());
        assertEquals(6, breaker.failureCount());
        assertEquals(CircuitState.OPEN, breaker.state());
    }

    @Test
    void becomesHalfOpenOnlyAfterRecoveryTimeout() {
        tripOpen();

        clock.advance(Duration.ofSeconds(60));
        assertFalse(breaker.canExecute());

        clock.advance(Duration.ofMillis(1));
        assertTrue(breaker.canExecute());
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
    }

    @Test
    void canExecuteDoesNotMutateState() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        assertTrue(breaker.canExecute());
        assertTrue(breaker.canExecute());
        assertEquals(5, breaker.failureCount());
    }

    @Test
    void successInHalfOpenCloses() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        breaker.recordSuccess();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(0, breaker.failureCount());
        assertEquals(1, breaker.successfulCalls());
    }

    @Test
    void failureInHalfOpenReopens() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        breaker.recordFailure();

        assertFalse(breaker.canExecute());
        assertEquals(CircuitState.OPEN, breaker.state());
        assertEquals(6, breaker.failureCount());
    }

    @Test
    void successResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        breaker.recordSuccess();

        assertEquals(0, breaker.failureCount());
        assertEquals(CircuitState.CLOSED, breaker.state());

        for (int i = 0; i < 4; i++) {
            breaker.recordFailure();
        }
        assertTrue(breaker.canExecute());
    }

    @Test
    void snapshotCarriesCountersAndLastFailure() {
        breaker.recordSuccess();
        breaker.recordFailure();

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals(CircuitState.CLOSED, snapshot.state());
        assertEquals(1, snapshot.failureCount());
        assertEquals(1, snapshot.successfulCalls());
        assertNotNull(snapshot.lastFailureAt());
    }

    @Test
    void rejectsInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker(0, Duration.ofSeconds(1), clock));
    }

    private void tripOpen() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.state());
    }
}

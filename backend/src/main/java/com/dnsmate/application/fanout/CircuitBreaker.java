/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.dnsmate.domain.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-endpoint circuit breaker.
 *
 * <p>Opens after {@code failureThreshold} failures without an intervening success. Once
 * {@code recoveryTimeout} has passed since the last failure the breaker reads as
 * {@link CircuitState#HALF_OPEN} and lets calls through again; every concurrent caller may
 * try a call at that point, there is no single-flight gate. A success in half-open closes it.
 *
 * <p>All transitions are serialized on the instance monitor. State lives in memory only and
 * is lost on restart.
 */
public class CircuitBreaker {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private long successfulCalls;

    public CircuitBreaker(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public CircuitBreaker() {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, Clock.systemUTC());
    }

    /**
     * Whether a call may go through right now. Does not change the stored state.
     */
    public synchronized boolean canExecute() {
        return effectiveState(clock.instant()) != CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        CircuitState current = effectiveState(clock.instant());
        failureCount = 0;
        successfulCalls++;
        state = current == CircuitState.HALF_OPEN ? CircuitState.CLOSED : current;
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        CircuitState current = effectiveState(now);
        failureCount++;
        lastFailureAt = now;
        state = failureCount >= failureThreshold ? CircuitState.OPEN : current;
    }

    public synchronized CircuitState state() {
        return effectiveState(clock.instant());
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public synchronized long successfulCalls() {
        return successfulCalls;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(effectiveState(clock.instant()), failureCount, successfulCalls, lastFailureAt);
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration recoveryTimeout() {
        return recoveryTimeout;
    }

    private CircuitState effectiveState(Instant now) {
        if (state != CircuitState.OPEN) return state;
        if (lastFailureAt == null) return CircuitState.OPEN;
        if (Duration.between(lastFailureAt, now).compareTo(recoveryTimeout) > 0) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.OPEN;
    }
}

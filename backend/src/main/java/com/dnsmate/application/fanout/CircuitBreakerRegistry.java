/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Endpoint id to breaker map shared by every in-flight operation. Breakers are created on
 * first use with the deployment-wide threshold and recovery timeout.
 */
public class CircuitBreakerRegistry {
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final Map<Long, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker forEndpoint(long endpointId) {
        return breakers.computeIfAbsent(endpointId, id -> new CircuitBreaker(failureThreshold, recoveryTimeout, clock));
    }

    public Optional<CircuitBreaker> find(long endpointId) {
        return Optional.ofNullable(breakers.get(endpointId));
    }

    public CircuitBreakerSnapshot snapshot(long endpointId) {
        CircuitBreaker breaker = breakers.get(endpointId);
        return breaker == null ? CircuitBreakerSnapshot.initial() : breaker.snapshot();
    }

    public void forget(long endpointId) {
        breakers.remove(endpointId);
    }
}

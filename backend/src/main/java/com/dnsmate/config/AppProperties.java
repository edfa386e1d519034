/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.config;

import com.dnsmate.application.fanout.CircuitBreaker;
import com.dnsmate.application.fanout.PerformanceMetrics;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "dnsmate")
public record AppProperties(
        Crypto crypto,
        Fanout fanout
) {
    public AppProperties {
        if (fanout == null) {
            fanout = new Fanout(null, 0, 0, null);
        }
    }

    public record Crypto(String encryptionKeyBase64) {}

    public record Fanout(
            Duration timeout,
            int coreThreads,
            int metricsWindow,
            CircuitBreakerPolicy circuitBreaker
    ) {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
        public static final int DEFAULT_CORE_THREADS = 8;

        public Fanout {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = DEFAULT_TIMEOUT;
            if (coreThreads < 0) coreThreads = DEFAULT_CORE_THREADS;
            if (metricsWindow < 1) metricsWindow = PerformanceMetrics.DEFAULT_WINDOW;
            if (circuitBreaker == null) circuitBreaker = new CircuitBreakerPolicy(0, null);
        }
    }

    public record CircuitBreakerPolicy(int failureThreshold, Duration recoveryTimeout) {
        public CircuitBreakerPolicy {
            if (failureThreshold < 1) failureThreshold = CircuitBreaker.DEFAULT_FAILURE_THRESHOLD;
            if (recoveryTimeout == null || recoveryTimeout.isNegative()) recoveryTimeout = CircuitBreaker.DEFAULT_RECOVERY_TIMEOUT;
        }
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.dnsmate.domain.model.CircuitState;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        CircuitState state,
        int failureCount,
        long successfulCalls,
        Instant lastFailureAt
) {
    public static CircuitBreakerSnapshot initial() {
        return new CircuitBreakerSnapshot(CircuitState.CLOSED, 0, 0, null);
    }
}

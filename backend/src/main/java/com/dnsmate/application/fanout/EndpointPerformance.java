/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

public record EndpointPerformance(
        double avgResponseTimeMs,
        long minResponseTimeMs,
        long maxResponseTimeMs,
        int totalCalls
) {
    public static EndpointPerformance none() {
        return new EndpointPerformance(0.0, 0, 0, 0);
    }
}

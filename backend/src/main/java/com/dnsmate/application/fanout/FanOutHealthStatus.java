/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import java.util.Map;

public record FanOutHealthStatus(
        int totalEndpoints,
        int activeEndpoints,
        int healthyEndpoints,
        boolean multiEndpointMode,
        Map<String, CircuitBreakerSnapshot> circuitBreakers,
        Map<String, EndpointPerformance> performance
) {}

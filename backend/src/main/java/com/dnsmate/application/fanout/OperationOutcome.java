/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Result of one logical operation on one endpoint.
 */
public record OperationOutcome(
        long endpointId,
        String endpointName,
        boolean success,
        JsonNode payload,
        String error,
        long responseTimeMs,
        Instant timestamp
) {
    public static OperationOutcome succeeded(long endpointId, String endpointName, JsonNode payload, long responseTimeMs) {
        return new OperationOutcome(endpointId, endpointName, true, payload, null, responseTimeMs, Instant.now());
    }

    public static OperationOutcome failed(long endpointId, String endpointName, String error, long responseTimeMs) {
        return new OperationOutcome(endpointId, endpointName, false, null, error, responseTimeMs, Instant.now());
    }
}

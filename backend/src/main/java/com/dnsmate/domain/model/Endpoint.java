/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.domain.model;

import java.time.Duration;

/**
 * One configured DNS management API server, as seen by the fan-out layer.
 * Read-only: changes go through the endpoint settings service.
 */
public record Endpoint(
        long id,
        String name,
        String apiUrl,
        String apiKey,
        Duration timeout,
        boolean verifySsl,
        boolean active,
        boolean multiEndpointEnabled,
        boolean isDefault
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public Endpoint {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
    }

    public boolean fanOutCandidate() {
        return active && multiEndpointEnabled;
    }

    @Override
    public String toString() {
        return "Endpoint[id=" + id + ", name=" + name + ", apiUrl=" + apiUrl
                + ", active=" + active + ", multiEndpointEnabled=" + multiEndpointEnabled
                + ", isDefault=" + isDefault + "]";
    }
}

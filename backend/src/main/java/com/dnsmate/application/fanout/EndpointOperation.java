/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.dnsmate.infrastructure.dns.DnsEndpointClient;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One logical write, expressed against the client capability of a single endpoint.
 * Returning {@code null} is allowed for operations without a payload.
 */
@FunctionalInterface
public interface EndpointOperation {
    JsonNode execute(DnsEndpointClient client);
}

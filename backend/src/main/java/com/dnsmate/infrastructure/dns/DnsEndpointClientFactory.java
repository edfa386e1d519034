/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

import com.dnsmate.domain.model.Endpoint;

public interface DnsEndpointClientFactory {
    DnsEndpointClient clientFor(Endpoint endpoint);
}

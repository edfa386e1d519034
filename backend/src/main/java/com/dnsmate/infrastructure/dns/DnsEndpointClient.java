/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

import com.dnsmate.domain.model.RecordSpec;
import com.dnsmate.domain.model.ZoneSpec;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Operations a DNS management endpoint must support. Implementations make exactly one
 * round-trip per call, never retry, and fail with {@link EndpointException}.
 */
public interface DnsEndpointClient {
    JsonNode createZone(ZoneSpec zone);

    void deleteZone(String zoneName);

    JsonNode addRecord(String zoneName, RecordSpec record);

    JsonNode updateRecord(String zoneName, RecordSpec record);

    void deleteRecord(String zoneName, String recordName, String recordType);

    ServerInfo testConnection();
}

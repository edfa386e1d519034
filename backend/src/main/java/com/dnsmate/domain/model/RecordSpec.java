/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.domain.model;

public record RecordSpec(
        String name,
        String type,
        String content,
        Integer ttl,
        Integer priority,
        boolean disabled
) {
    public static final int DEFAULT_TTL = 300;
    public static final String ZONE_APEX = "@";

    public RecordSpec {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("record type is required");
        }
        name = name == null || name.isBlank() ? ZONE_APEX : name.trim();
        type = type.trim().toUpperCase();
        ttl = ttl == null || ttl <= 0 ? DEFAULT_TTL : ttl;
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.domain.model;

import java.util.List;

public record ZoneSpec(
        String name,
        String kind,
        List<String> masters,
        String account,
        List<String> nameservers
) {
    public static final String DEFAULT_KIND = "Native";

    public ZoneSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("zone name is required");
        }
        kind = kind == null || kind.isBlank() ? DEFAULT_KIND : kind;
        masters = masters == null ? List.of() : List.copyOf(masters);
        nameservers = nameservers == null ? List.of() : List.copyOf(nameservers);
    }

    public static ZoneSpec of(String name) {
        return new ZoneSpec(name, DEFAULT_KIND, List.of(), null, List.of());
    }
}

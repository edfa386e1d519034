/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.domain.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public String value() {
        return name().toLowerCase();
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

public enum EndpointErrorType {
    TIMEOUT,
    CONNECTION,
    HTTP_4XX,
    HTTP_5XX,
    UNKNOWN
}

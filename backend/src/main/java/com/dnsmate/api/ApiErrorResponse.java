/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}

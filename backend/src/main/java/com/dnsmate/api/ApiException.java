/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api;

import org.springframework.http.HttpStatus;

public class ApiException extends RuntimeException {
    private final HttpStatus status;

    public ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

public class EndpointException extends RuntimeException {
    private final String endpointName;
    private final EndpointErrorType type;

    public EndpointException(String endpointName, EndpointErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.endpointName = endpointName;
        this.type = type;
    }

    public EndpointException(String endpointName, EndpointErrorType type, String message) {
        this(endpointName, type, message, null);
    }

    public String getEndpointName() {
        return endpointName;
    }

    public EndpointErrorType getType() {
        return type;
    }

    public boolean isTimeout() {
        return type == EndpointErrorType.TIMEOUT;
    }
}

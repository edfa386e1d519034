/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application;

public class EndpointRegistryException extends RuntimeException {
    public EndpointRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application;

import com.dnsmate.domain.model.Endpoint;

import java.util.List;
import java.util.Optional;

/**
 * Source of configured endpoints for the fan-out layer.
 * Implementations throw {@link EndpointRegistryException} when the endpoints cannot be read.
 */
public interface EndpointRegistry {
    /**
     * All configured endpoints, active or not, ordered by id.
     */
    List<Endpoint> getEndpoints();

    /**
     * The endpoint used in single-endpoint mode: the active endpoint flagged as default,
     * otherwise the active endpoint with the lowest id.
     */
    Optional<Endpoint> getDefaultEndpoint();
}

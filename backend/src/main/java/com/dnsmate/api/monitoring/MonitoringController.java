/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.monitoring;

import com.dnsmate.application.fanout.FanOutHealthStatus;
import com.dnsmate.application.fanout.MultiEndpointOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {
    private final MultiEndpointOrchestrator orchestrator;

    public MonitoringController(MultiEndpointOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/dns-endpoints")
    public FanOutHealthStatus dnsEndpoints() {
        return orchestrator.getHealthStatus();
    }
}

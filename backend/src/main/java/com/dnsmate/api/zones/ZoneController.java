/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.zones;

import com.dnsmate.application.fanout.MultiEndpointOrchestrator;
import com.dnsmate.domain.model.ZoneSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/zones")
public class ZoneController {
    private final MultiEndpointOrchestrator orchestrator;

    public ZoneController(MultiEndpointOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<FanOutResponse> create(@Valid @RequestBody CreateZoneRequest request) {
        ZoneSpec zone = new ZoneSpec(request.name(), request.kind(), request.masters(), request.account(), request.nameservers());
        return FanOutResponse.toResponse(orchestrator.createZoneOnAll(zone), HttpStatus.CREATED);
    }

    @DeleteMapping("/{zone}")
    public ResponseEntity<FanOutResponse> delete(@PathVariable("zone") String zone) {
        return FanOutResponse.toResponse(orchestrator.deleteZoneFromAll(zone), HttpStatus.OK);
    }

    public record CreateZoneRequest(
            @NotBlank String name,
            String kind,
            List<String> masters,
            String account,
            List<String> nameservers
    ) {}
}

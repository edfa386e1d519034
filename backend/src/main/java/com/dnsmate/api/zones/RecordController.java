/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.zones;

import com.dnsmate.application.fanout.MultiEndpointOrchestrator;
import com.dnsmate.domain.model.RecordSpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/zones/{zone}/records")
public class RecordController {
    private final MultiEndpointOrchestrator orchestrator;

    public RecordController(MultiEndpointOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<FanOutResponse> add(@PathVariable("zone") String zone, @Valid @RequestBody RecordRequest request) {
        return FanOutResponse.toResponse(orchestrator.addRecordToAll(zone, request.toSpec()), HttpStatus.CREATED);
    }

    @PutMapping
    public ResponseEntity<FanOutResponse> update(@PathVariable("zone") String zone, @Valid @RequestBody RecordRequest request) {
        return FanOutResponse.toResponse(orchestrator.updateRecordOnAll(zone, request.toSpec()), HttpStatus.OK);
    }

    @DeleteMapping("/{name}/{type}")
    public ResponseEntity<FanOutResponse> delete(
            @PathVariable("zone") String zone,
            @PathVariable("name") String name,
            @PathVariable("type") String type
    ) {
        return FanOutResponse.toResponse(orchestrator.deleteRecordFromAll(zone, name, type), HttpStatus.OK);
    }

    public record RecordRequest(
            String name,
            @NotBlank String type,
            @NotBlank String content,
            Integer ttl,
            Integer priority,
            Boolean disabled
    ) {
        RecordSpec toSpec() {
            return new RecordSpec(name, type, content, ttl, priority, Boolean.TRUE.equals(disabled));
        }
    }
}

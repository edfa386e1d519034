/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.endpoints;

import com.dnsmate.application.EndpointSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/endpoints")
public class EndpointSettingsController {
    private final EndpointSettingsService endpointSettingsService;

    public EndpointSettingsController(EndpointSettingsService endpointSettingsService) {
        this.endpointSettingsService = endpointSettingsService;
    }

    @GetMapping
    public List<EndpointSettingsService.EndpointView> list() {
        return endpointSettingsService.list();
    }

    @GetMapping("/health")
    public EndpointSettingsService.EndpointHealthSummary health() {
        return endpointSettingsService.checkAllEndpoints();
    }

    @GetMapping("/{id}")
    public EndpointSettingsService.EndpointView get(@PathVariable("id") long id) {
        return endpointSettingsService.get(id);
    }

    @PostMapping
    public ResponseEntity<EndpointSettingsService.EndpointView> create(
            @RequestBody EndpointSettingsService.EndpointRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(endpointSettingsService.create(request));
    }

    @PutMapping("/{id}")
    public EndpointSettingsService.EndpointView update(
            @PathVariable("id") long id,
            @RequestBody EndpointSettingsService.EndpointRequest request
    ) {
        return endpointSettingsService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        endpointSettingsService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/test")
    public EndpointSettingsService.ConnectionTestResult test(@PathVariable("id") long id) {
        return endpointSettingsService.testConnection(id);
    }

    @PostMapping("/test")
    public EndpointSettingsService.ConnectionTestResult testUnsaved(
            @RequestBody EndpointSettingsService.EndpointRequest request
    ) {
        return endpointSettingsService.testConnection(request);
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application;

import com.dnsmate.api.ApiException;
import com.dnsmate.application.EndpointSettingsService.ConnectionTestResult;
import com.dnsmate.application.EndpointSettingsService.EndpointHealthSummary;
import com.dnsmate.application.EndpointSettingsService.EndpointRequest;
import com.dnsmate.application.EndpointSettingsService.EndpointView;
import com.dnsmate.application.fanout.CircuitBreakerRegistry;
import com.dnsmate.domain.model.Endpoint;
import com.dnsmate.infrastructure.persistence.repository.EndpointSettingsRepository;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class EndpointSettingsServiceTest {
    private static WireMockServer powerDns;

    @Autowired
    private EndpointSettingsService service;

    @Autowired
    private EndpointSettingsRepository repository;

    @Autowired
    private CircuitBreakerRegistry circuitBreakers;

    @BeforeAll
    static void startPowerDns() {
        powerDns = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        powerDns.start();
    }

    @AfterAll
    static void stopPowerDns() {
        powerDns.stop();
    }

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        powerDns.resetAll();
    }

    @Test
    void createStoresEncryptedKeyAndMasksIt() {
        EndpointView view = service.create(request("primary", "http://pdns-1:8081/", "super-secret-key", null));

        assertEquals("http://pdns-1:8081", view.apiUrl());
        assertEquals("supe****-key", view.apiKey());
        assertEquals(30, view.timeoutSeconds());
        assertTrue(view.verifySsl());
        assertTrue(view.active());

        String stored = repository.findById(view.id()).orElseThrow().getApiKeyEnc();
        assertNotEquals("super-secret-key", stored);
        assertTrue(stored.startsWith("v1:"));

        Endpoint endpoint = service.getEndpoints().get(0);
        assertEquals("super-secret-key", endpoint.apiKey());
    }

    @Test
    void onlyOneEndpointIsDefault() {
        EndpointView first = service.create(request("primary", "http://pdns-1:8081", "key-1", true));
        EndpointView second = service.create(request("secondary", "http://pdns-2:8081", "key-2", true));

        assertFalse(service.get(first.id()).defaultEndpoint());
        assertTrue(service.get(second.id()).defaultEndpoint());
        assertEquals("secondary", service.getDefaultEndpoint().orElseThrow().name());
    }

    @Test
    void defaultFallsBackToLowestIdActiveEndpoint() {
        EndpointView first = service.create(request("primary", "http://pdns-1:8081", "key-1", false));
        service.create(request("secondary", "http://pdns-2:8081", "key-2", false));

        assertEquals(first.id(), service.getDefaultEndpoint().orElseThrow().id());

        service.update(first.id(), new EndpointRequest(null, null, null, null, null, null, false, null, null));
        assertEquals("secondary", service.getDefaultEndpoint().orElseThrow().name());
    }

    @Test
    void updateKeepsUnsetFields() {
        EndpointView created = service.create(request("primary", "http://pdns-1:8081", "key-1-long-value", false));

        EndpointView updated = service.update(created.id(),
                new EndpointRequest(null, null, null, "main server", 10, null, null, true, null));

        assertEquals("primary", updated.name());
        assertEquals("main server", updated.description());
        assertEquals(10, updated.timeoutSeconds());
        assertTrue(updated.multiEndpointEnabled());
        assertEquals("key-1-long-value", service.getEndpoints().get(0).apiKey());
    }

    @Test
    void rejectsInvalidInput() {
        ApiException badUrl = assertThrows(ApiException.class,
                () -> service.create(request("primary", "ftp://pdns-1", "key", null)));
        assertEquals(HttpStatus.BAD_REQUEST, badUrl.getStatus());

        ApiException missingKey = assertThrows(ApiException.class,
                () -> service.create(request("primary", "http://pdns-1", " ", null)));
        assertEquals(HttpStatus.BAD_REQUEST, missingKey.getStatus());

        ApiException badTimeout = assertThrows(ApiException.class, () -> service.create(
                new EndpointRequest("primary", "http://pdns-1", "key", null, 0, null, null, null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, badTimeout.getStatus());
    }

    @Test
    void duplicateNameIsConflict() {
        service.create(request("primary", "http://pdns-1:8081", "key-1", null));

        ApiException ex = assertThrows(ApiException.class,
                () -> service.create(request("primary", "http://pdns-2:8081", "key-2", null)));
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
    }

    @Test
    void unknownEndpointIsNotFound() {
        ApiException ex = assertThrows(ApiException.class, () -> service.get(999_999L));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
    }

    @Test
    void deleteForgetsCircuitBreaker() {
        EndpointView created = service.create(request("primary", "http://pdns-1:8081", "key-1", null));
        circuitBreakers.forEndpoint(created.id()).recordFailure();

        service.delete(created.id());

        assertTrue(circuitBreakers.find(created.id()).isEmpty());
        assertTrue(service.list().isEmpty());
    }

    @Test
    void testConnectionReportsServerVersion() {
        powerDns.stubFor(get(urlEqualTo("/api/v1/servers/localhost")).willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"version\":\"4.8.3\"}")));
        powerDns.stubFor(get(urlEqualTo("/api/v1/servers/localhost/zones")).willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("[]")));
        EndpointView created = service.create(request("primary", powerDns.baseUrl(), "key-1", null));

        ConnectionTestResult result = service.testConnection(created.id());

        assertTrue(result.success(), result.message());
        assertEquals("4.8.3", result.serverVersion());
        assertEquals(0, result.zonesCount());
    }

    @Test
    void testConnectionOfUnsavedSettingsReportsFailure() {
        powerDns.stubFor(get(urlEqualTo("/api/v1/servers/localhost")).willReturn(aResponse().withStatus(401).withBody("Unauthorized")));

        ConnectionTestResult result = service.testConnection(request("candidate", powerDns.baseUrl(), "wrong", null));

        assertFalse(result.success());
        assertEquals("HTTP 401: Unauthorized", result.message());
        assertNull(result.serverVersion());
    }

    @Test
    void checkAllEndpointsCountsHealthyAndUnhealthy() {
        powerDns.stubFor(get(urlEqualTo("/api/v1/servers/localhost")).willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"version\":\"4.8.3\"}")));
        powerDns.stubFor(get(urlEqualTo("/api/v1/servers/localhost/zones")).willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("[]")));
        service.create(request("reachable", powerDns.baseUrl(), "key-1", null));
        service.create(request("unreachable", "http://127.0.0.1:1", "key-2", null));

        EndpointHealthSummary summary = service.checkAllEndpoints();

        assertEquals(2, summary.totalEndpoints());
        assertEquals(1, summary.healthyEndpoints());
        assertEquals(1, summary.unhealthyEndpoints());
        List<String> healthy = summary.endpoints().stream()
                .filter(EndpointSettingsService.EndpointHealth::healthy)
                .map(EndpointSettingsService.EndpointHealth::name)
                .toList();
        assertEquals(List.of("reachable"), healthy);
    }

    private static EndpointRequest request(String name, String apiUrl, String apiKey, Boolean isDefault) {
        return new EndpointRequest(name, apiUrl, apiKey, null, null, null, null, null, isDefault);
    }
}

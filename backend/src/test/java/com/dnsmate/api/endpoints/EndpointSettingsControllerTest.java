/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.endpoints;

import com.dnsmate.infrastructure.persistence.repository.EndpointSettingsRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class EndpointSettingsControllerTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EndpointSettingsRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    void endpointLifecycle() throws Exception {
        ResponseEntity<String> created = restTemplate.exchange("/api/endpoints", HttpMethod.POST, json("""
                {"name":"primary","apiUrl":"http://pdns-1:8081","apiKey":"super-secret-key","multiEndpointEnabled":true}
                """), String.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        Map<String, Object> view = objectMapper.readValue(created.getBody(), new TypeReference<>() {});
        assertEquals("supe****-key", view.get("apiKey"));
        Number id = (Number) view.get("id");

        ResponseEntity<String> listed = restTemplate.getForEntity("/api/endpoints", String.class);
        List<Map<String, Object>> all = objectMapper.readValue(listed.getBody(), new TypeReference<>() {});
        assertEquals(1, all.size());

        ResponseEntity<String> updated = restTemplate.exchange("/api/endpoints/" + id, HttpMethod.PUT,
                json("{\"active\":false}"), String.class);
        assertEquals(HttpStatus.OK, updated.getStatusCode());
        Map<String, Object> updatedView = objectMapper.readValue(updated.getBody(), new TypeReference<>() {});
        assertFalse((Boolean) updatedView.get("active"));

        ResponseEntity<Void> deleted = restTemplate.exchange("/api/endpoints/" + id, HttpMethod.DELETE,
                HttpEntity.EMPTY, Void.class);
        assertEquals(HttpStatus.NO_CONTENT, deleted.getStatusCode());

        ResponseEntity<String> missing = restTemplate.getForEntity("/api/endpoints/" + id, String.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }

    @Test
    void duplicateNameIsConflict() {
        String body = "{\"name\":\"primary\",\"apiUrl\":\"http://pdns-1:8081\",\"apiKey\":\"k\"}";
        restTemplate.exchange("/api/endpoints", HttpMethod.POST, json(body), String.class);

        ResponseEntity<String> res = restTemplate.exchange("/api/endpoints", HttpMethod.POST, json(body), String.class);

        assertEquals(HttpStatus.CONFLICT, res.getStatusCode());
    }

    @Test
    void monitoringReportsConfiguredEndpoints() throws Exception {
        restTemplate.exchange("/api/endpoints", HttpMethod.POST,
                json("{\"name\":\"a\",\"apiUrl\":\"http://pdns-1:8081\",\"apiKey\":\"k\",\"multiEndpointEnabled\":true}"), String.class);
        restTemplate.exchange("/api/endpoints", HttpMethod.POST,
                json("{\"name\":\"b\",\"apiUrl\":\"http://pdns-2:8081\",\"apiKey\":\"k\",\"multiEndpointEnabled\":true}"), String.class);

        ResponseEntity<String> res = restTemplate.getForEntity("/api/monitoring/dns-endpoints", String.class);

        assertEquals(HttpStatus.OK, res.getStatusCode());
        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertEquals(2, body.get("totalEndpoints"));
        assertEquals(2, body.get("healthyEndpoints"));
        assertEquals(true, body.get("multiEndpointMode"));
        assertNotNull(((Map<?, ?>) body.get("circuitBreakers")).get("a"));
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

import com.dnsmate.domain.model.Endpoint;
import com.dnsmate.domain.model.RecordSpec;
import com.dnsmate.domain.model.ZoneSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Client for the PowerDNS HTTP API of a single endpoint.
 */
public class PowerDnsClient implements DnsEndpointClient {
    private static final Logger log = LoggerFactory.getLogger(PowerDnsClient.class);
    private static final String API_PREFIX = "/api/v1/servers/localhost";
    private static final String API_KEY_HEADER = "X-API-Key";
    private static final Set<String> PRIORITY_TYPES = Set.of("MX", "SRV");
    private static final int MAX_ERROR_BODY = 200;

    private final Endpoint endpoint;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public PowerDnsClient(Endpoint endpoint, WebClient webClient, ObjectMapper objectMapper) {
        this.endpoint = endpoint;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode createZone(ZoneSpec zone) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", canonicalZone(zone.name()));
        body.put("kind", zone.kind());
        ArrayNode nameservers = body.putArray("nameservers");
        zone.nameservers().forEach(nameservers::add);
        if (!zone.masters().isEmpty()) {
            ArrayNode masters = body.putArray("masters");
            zone.masters().forEach(masters::add);
        }
        if (zone.account() != null && !zone.account().isBlank()) {
            body.put("account", zone.account());
        }
        return exchange(HttpMethod.POST, "/zones", body);
    }

    @Override
    public void deleteZone(String zoneName) {
        exchange(HttpMethod.DELETE, "/zones/" + canonicalZone(zoneName), null);
    }

    @Override
    public JsonNode addRecord(String zoneName, RecordSpec record) {
        return exchange(HttpMethod.PATCH, "/zones/" + canonicalZone(zoneName), replaceRrset(zoneName, record));
    }

    /**
     * PowerDNS replaces the whole rrset on PATCH, so add and update send the same request.
     */
    @Override
    public JsonNode updateRecord(String zoneName, RecordSpec record) {
        return addRecord(zoneName, record);
    }

    @Override
    public void deleteRecord(String zoneName, String recordName, String recordType) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode rrset = body.putArray("rrsets").addObject();
        rrset.put("name", canonicalName(zoneName, recordName));
        rrset.put("type", recordType.toUpperCase());
        rrset.put("changetype", "DELETE");
        exchange(HttpMethod.PATCH, "/zones/" + canonicalZone(zoneName), body);
    }

    @Override
    public ServerInfo testConnection() {
        JsonNode server = exchange(HttpMethod.GET, "", null);
        String version = server.path("version").isMissingNode() ? null : server.path("version").asText();
        Integer zonesCount = null;
        try {
            JsonNode zones = exchange(HttpMethod.GET, "/zones", null);
            zonesCount = zones.isArray() ? zones.size() : null;
        } catch (EndpointException e) {
            log.debug("Zone count unavailable on endpoint {}: {}", endpoint.name(), e.getMessage());
        }
        return new ServerInfo(version, zonesCount);
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    private ObjectNode replaceRrset(String zoneName, RecordSpec record) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode rrset = body.putArray("rrsets").addObject();
        rrset.put("name", canonicalName(zoneName, record.name()));
        rrset.put("type", record.type());
        rrset.put("ttl", record.ttl());
        rrset.put("changetype", "REPLACE");
        ObjectNode entry = rrset.putArray("records").addObject();
        entry.put("content", contentFor(record));
        entry.put("disabled", record.disabled());
        return body;
    }

    private JsonNode exchange(HttpMethod method, String path, JsonNode body) {
        Duration timeout = endpoint.timeout();
        try {
            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(API_PREFIX + path)
                    .header(API_KEY_HEADER, endpoint.apiKey())
                    .accept(MediaType.APPLICATION_JSON);
            WebClient.RequestHeadersSpec<?> spec = body == null
                    ? request
                    : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
            JsonNode response = spec.retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .switchIfEmpty(Mono.fromSupplier(objectMapper::createObjectNode))
                    .block();
            return response == null ? objectMapper.createObjectNode() : response;
        } catch (WebClientResponseException e) {
            throw mapResponseException(method, path, e);
        } catch (WebClientRequestException e) {
            if (hasCause(e, TimeoutException.class) || hasCause(e, ReadTimeoutException.class)) {
                throw timeout(timeout, e);
            }
            throw new EndpointException(endpoint.name(), EndpointErrorType.CONNECTION,
                    "Connection failed: " + rootMessage(e), e);
        } catch (RuntimeException e) {
            if (hasCause(e, TimeoutException.class) || hasCause(e, ReadTimeoutException.class)) {
                throw timeout(timeout, e);
            }
            throw new EndpointException(endpoint.name(), EndpointErrorType.UNKNOWN,
                    "Request failed: " + rootMessage(e), e);
        }
    }

    private EndpointException mapResponseException(HttpMethod method, String path, WebClientResponseException e) {
        int status = e.getStatusCode().value();
        EndpointErrorType type;
        if (status >= 500) type = EndpointErrorType.HTTP_5XX;
        else if (status == 408 || status == 504) type = EndpointErrorType.TIMEOUT;
        else type = EndpointErrorType.HTTP_4XX;

        log.warn("PowerDNS error endpoint={} method={} path={} status={}", endpoint.name(), method, path, status);
        String detail = e.getResponseBodyAsString();
        if (detail.length() > MAX_ERROR_BODY) {
            detail = detail.substring(0, MAX_ERROR_BODY);
        }
        return new EndpointException(endpoint.name(), type, "HTTP " + status + ": " + detail, e);
    }

    private EndpointException timeout(Duration timeout, Throwable cause) {
        return new EndpointException(endpoint.name(), EndpointErrorType.TIMEOUT,
                "Request to " + endpoint.name() + " timed out after " + timeout.toSeconds() + "s", cause);
    }

    private static String contentFor(RecordSpec record) {
        if (record.priority() != null && PRIORITY_TYPES.contains(record.type())) {
            return record.priority() + " " + record.content();
        }
        return record.content();
    }

    static String canonicalZone(String zoneName) {
        String zone = zoneName.trim();
        return zone.endsWith(".") ? zone : zone + ".";
    }

    static String canonicalName(String zoneName, String recordName) {
        String zone = canonicalZone(zoneName);
        if (recordName == null || recordName.isBlank() || RecordSpec.ZONE_APEX.equals(recordName.trim())) {
            return zone;
        }
        String name = recordName.trim();
        if (name.endsWith(".")) return name;
        if ((name + ".").endsWith("." + zone) || (name + ".").equals(zone)) return name + ".";
        return name + "." + zone;
    }

    private static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        Throwable t = ex;
        while (t != null) {
            if (type.isInstance(t)) return true;
            t = t.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}

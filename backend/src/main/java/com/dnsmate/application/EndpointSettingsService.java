/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application;

import com.dnsmate.api.ApiException;
import com.dnsmate.application.fanout.CircuitBreakerRegistry;
import com.dnsmate.application.fanout.PerformanceMetrics;
import com.dnsmate.domain.model.Endpoint;
import com.dnsmate.infrastructure.crypto.AesGcmCrypto;
import com.dnsmate.infrastructure.dns.DnsEndpointClientFactory;
import com.dnsmate.infrastructure.dns.EndpointException;
import com.dnsmate.infrastructure.dns.ServerInfo;
import com.dnsmate.infrastructure.persistence.entity.EndpointSettingsEntity;
import com.dnsmate.infrastructure.persistence.repository.EndpointSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Stored DNS endpoint configuration. Also the {@link EndpointRegistry} the fan-out layer reads.
 */
@Service
public class EndpointSettingsService implements EndpointRegistry {
    private static final Logger log = LoggerFactory.getLogger(EndpointSettingsService.class);
    private static final int MIN_TIMEOUT_SECONDS = 1;
    private static final int MAX_TIMEOUT_SECONDS = 300;
    private static final int QUICK_CHECK_TIMEOUT_SECONDS = 10;

    private final EndpointSettingsRepository repository;
    private final AesGcmCrypto crypto;
    private final DnsEndpointClientFactory clientFactory;
    private final CircuitBreakerRegistry circuitBreakers;
    private final PerformanceMetrics performanceMetrics;
    private final ExecutorService executor;

    public EndpointSettingsService(
            EndpointSettingsRepository repository,
            AesGcmCrypto crypto,
            DnsEndpointClientFactory clientFactory,
            CircuitBreakerRegistry circuitBreakers,
            PerformanceMetrics performanceMetrics,
            @Qualifier("healthCheckExecutor") ExecutorService executor
    ) {
        this.repository = repository;
        this.crypto = crypto;
        this.clientFactory = clientFactory;
        this.circuitBreakers = circuitBreakers;
        this.performanceMetrics = performanceMetrics;
        this.executor = executor;
    }

    @Override
    public List<Endpoint> getEndpoints() {
        try {
            return repository.findAllByOrderByIdAsc().stream().map(this::toEndpoint).toList();
        } catch (DataAccessException e) {
            throw new EndpointRegistryException("DNS endpoint settings unavailable", e);
        }
    }

    @Override
    public Optional<Endpoint> getDefaultEndpoint() {
        try {
            return repository.findFirstByDefaultEndpointTrueAndActiveTrueOrderByIdAsc()
                    .or(repository::findFirstByActiveTrueOrderByIdAsc)
                    .map(this::toEndpoint);
        } catch (DataAccessException e) {
            throw new EndpointRegistryException("DNS endpoint settings unavailable", e);
        }
    }

    public List<EndpointView> list() {
        return repository.findAllByOrderByIdAsc().stream().map(this::toView).toList();
    }

    public EndpointView get(long id) {
        return toView(require(id));
    }

    @Transactional
    public EndpointView create(EndpointRequest request) {
        if (request == null) throw new ApiException(HttpStatus.BAD_REQUEST, "Request body is required");
        String name = requireText(request.name(), "name");
        String apiUrl = validateApiUrl(requireText(request.apiUrl(), "apiUrl"));
        String apiKey = requireText(request.apiKey(), "apiKey");
        if (repository.existsByName(name)) {
            throw new ApiException(HttpStatus.CONFLICT, "DNS endpoint named '" + name + "' already exists");
        }

        boolean makeDefault = Boolean.TRUE.equals(request.defaultEndpoint());
        if (makeDefault) {
            repository.clearDefaults();
        }

        EndpointSettingsEntity entity = new EndpointSettingsEntity();
        entity.setName(name);
        entity.setApiUrl(apiUrl);
        entity.setApiKeyEnc(crypto.encrypt(apiKey));
        entity.setDescription(request.description());
        entity.setTimeoutSeconds(validateTimeout(request.timeoutSeconds(), 30));
        entity.setVerifySsl(request.verifySsl() == null || request.verifySsl());
        entity.setActive(request.active() == null || request.active());
        entity.setMultiEndpointEnabled(Boolean.TRUE.equals(request.multiEndpointEnabled()));
        entity.setDefaultEndpoint(makeDefault);

        EndpointSettingsEntity saved = repository.save(entity);
        log.info("DNS endpoint created id={} name={} default={}", saved.getId(), saved.getName(), makeDefault);
        return toView(saved);
    }

    /**
     * Partial update: null fields keep their stored value.
     */
    @Transactional
    public EndpointView update(long id, EndpointRequest request) {
        if (request == null) throw new ApiException(HttpStatus.BAD_REQUEST, "Request body is required");
        EndpointSettingsEntity entity = require(id);

        if (request.name() != null) {
            String name = requireText(request.name(), "name");
            if (!name.equals(entity.getName()) && repository.existsByName(name)) {
                throw new ApiException(HttpStatus.CONFLICT, "DNS endpoint named '" + name + "' already exists");
            }
            entity.setName(name);
        }
        if (request.apiUrl() != null) entity.setApiUrl(validateApiUrl(requireText(request.apiUrl(), "apiUrl")));
        if (request.apiKey() != null && !request.apiKey().isBlank()) entity.setApiKeyEnc(crypto.encrypt(request.apiKey().trim()));
        if (request.description() != null) entity.setDescription(request.description());
        if (request.timeoutSeconds() != null) entity.setTimeoutSeconds(validateTimeout(request.timeoutSeconds(), entity.getTimeoutSeconds()));
        if (request.verifySsl() != null) entity.setVerifySsl(request.verifySsl());
        if (request.active() != null) entity.setActive(request.active());
        if (request.multiEndpointEnabled() != null) entity.setMultiEndpointEnabled(request.multiEndpointEnabled());
        if (request.defaultEndpoint() != null) {
            if (request.defaultEndpoint()) {
                repository.clearDefaults();
            }
            entity.setDefaultEndpoint(request.defaultEndpoint());
        }

        EndpointSettingsEntity saved = repository.save(entity);
        log.info("DNS endpoint updated id={} name={}", saved.getId(), saved.getName());
        return toView(saved);
    }

    @Transactional
    public void delete(long id) {
        EndpointSettingsEntity entity = require(id);
        repository.delete(entity);
        circuitBreakers.forget(id);
        performanceMetrics.forget(id);
        log.info("DNS endpoint deleted id={} name={}", id, entity.getName());
    }

    public ConnectionTestResult testConnection(long id) {
        return testConnection(toEndpoint(require(id)));
    }

    public ConnectionTestResult testConnection(EndpointRequest request) {
        if (request == null) throw new ApiException(HttpStatus.BAD_REQUEST, "Request body is required");
        Endpoint endpoint = new Endpoint(
                0,
                request.name() == null || request.name().isBlank() ? "connection-test" : request.name().trim(),
                validateApiUrl(requireText(request.apiUrl(), "apiUrl")),
                requireText(request.apiKey(), "apiKey"),
                Duration.ofSeconds(validateTimeout(request.timeoutSeconds(), 30)),
                request.verifySsl() == null || request.verifySsl(),
                true,
                false,
                false
        );
        return testConnection(endpoint);
    }

    /**
     * Connection test against every active endpoint, run concurrently with a shortened timeout.
     */
    public EndpointHealthSummary checkAllEndpoints() {
        List<Endpoint> active = getEndpoints().stream().filter(Endpoint::active).toList();
        List<CompletableFuture<EndpointHealth>> checks = active.stream()
                .map(endpoint -> CompletableFuture.supplyAsync(() -> checkQuickly(endpoint), executor))
                .toList();

        List<EndpointHealth> results = checks.stream().map(CompletableFuture::join).toList();
        int healthy = (int) results.stream().filter(EndpointHealth::healthy).count();
        return new EndpointHealthSummary(results.size(), healthy, results.size() - healthy, Instant.now(), results);
    }

    private EndpointHealth checkQuickly(Endpoint endpoint) {
        Duration quick = Duration.ofSeconds(Math.max(1, Math.min(QUICK_CHECK_TIMEOUT_SECONDS, endpoint.timeout().toSeconds())));
        Endpoint quickCheck = new Endpoint(endpoint.id(), endpoint.name(), endpoint.apiUrl(), endpoint.apiKey(), quick,
                endpoint.verifySsl(), endpoint.active(), endpoint.multiEndpointEnabled(), endpoint.isDefault());
        ConnectionTestResult result = testConnection(quickCheck);
        return new EndpointHealth(endpoint.id(), endpoint.name(), endpoint.apiUrl(), result.success(), result);
    }

    private ConnectionTestResult testConnection(Endpoint endpoint) {
        long started = System.nanoTime();
        try {
            ServerInfo info = clientFactory.clientFor(endpoint).testConnection();
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            return new ConnectionTestResult(true, "Connection successful", elapsed, info.version(), info.zonesCount());
        } catch (EndpointException e) {
            log.warn("Connection test failed endpoint={} type={} message={}", endpoint.name(), e.getType(), e.getMessage());
            Long elapsed = e.isTimeout() ? null : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            return new ConnectionTestResult(false, e.getMessage(), elapsed, null, null);
        } catch (RuntimeException e) {
            log.error("Connection test failed endpoint={}", endpoint.name(), e);
            return new ConnectionTestResult(false, "Connection failed: " + e.getMessage(), null, null, null);
        }
    }

    private EndpointSettingsEntity require(long id) {
        return repository.findById(id)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "DNS endpoint " + id + " not found"));
    }

    private Endpoint toEndpoint(EndpointSettingsEntity entity) {
        return new Endpoint(
                entity.getId(),
                entity.getName(),
                entity.getApiUrl(),
                crypto.decrypt(entity.getApiKeyEnc()),
                Duration.ofSeconds(entity.getTimeoutSeconds()),
                entity.isVerifySsl(),
                entity.isActive(),
                entity.isMultiEndpointEnabled(),
                entity.isDefaultEndpoint()
        );
    }

    private EndpointView toView(EndpointSettingsEntity entity) {
        return new EndpointView(
                entity.getId(),
                entity.getName(),
                entity.getApiUrl(),
                maskValue(crypto.decrypt(entity.getApiKeyEnc())),
                entity.getDescription(),
                entity.getTimeoutSeconds(),
                entity.isVerifySsl(),
                entity.isActive(),
                entity.isMultiEndpointEnabled(),
                entity.isDefaultEndpoint(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "Missing required field: " + field);
        }
        return value.trim();
    }

    private static String validateApiUrl(String apiUrl) {
        try {
            URI uri = URI.create(apiUrl);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
                throw new ApiException(HttpStatus.BAD_REQUEST, "apiUrl must be an http(s) URL");
            }
        } catch (IllegalArgumentException e) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "apiUrl must be an http(s) URL");
        }
        return apiUrl.replaceAll("/+$", "");
    }

    private static int validateTimeout(Integer timeoutSeconds, int fallback) {
        if (timeoutSeconds == null) return fallback;
        if (timeoutSeconds < MIN_TIMEOUT_SECONDS || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new ApiException(HttpStatus.BAD_REQUEST,
                    "timeoutSeconds must be between " + MIN_TIMEOUT_SECONDS + " and " + MAX_TIMEOUT_SECONDS);
        }
        return timeoutSeconds;
    }

    private static String maskValue(String raw) {
        String trimmed = raw.trim();
        if (trimmed.length() <= 8) return "****";
        return trimmed.substring(0, 4) + "****" + trimmed.substring(trimmed.length() - 4);
    }

    public record EndpointRequest(
            String name,
            String apiUrl,
            String apiKey,
            String description,
            Integer timeoutSeconds,
            Boolean verifySsl,
            Boolean active,
            Boolean multiEndpointEnabled,
            Boolean defaultEndpoint
    ) {}

    public record EndpointView(
            long id,
            String name,
            String apiUrl,
            String apiKey,
            String description,
            int timeoutSeconds,
            boolean verifySsl,
            boolean active,
            boolean multiEndpointEnabled,
            boolean defaultEndpoint,
            Instant createdAt,
            Instant updatedAt
    ) {}

    public record ConnectionTestResult(
            boolean success,
            String message,
            Long responseTimeMs,
            String serverVersion,
            Integer zonesCount
    ) {}

    public record EndpointHealth(
            long endpointId,
            String name,
            String apiUrl,
            boolean healthy,
            ConnectionTestResult result
    ) {}

    public record EndpointHealthSummary(
            int totalEndpoints,
            int healthyEndpoints,
            int unhealthyEndpoints,
            Instant lastCheckTime,
            List<EndpointHealth> endpoints
    ) {}
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import com.dnsmate.application.EndpointRegistry;
import com.dnsmate.application.EndpointRegistryException;
import com.dnsmate.config.AppProperties;
import com.dnsmate.domain.model.CircuitState;
import com.dnsmate.domain.model.Endpoint;
import com.dnsmate.domain.model.RecordSpec;
import com.dnsmate.domain.model.ZoneSpec;
import com.dnsmate.infrastructure.dns.DnsEndpointClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Replicates one logical write across the configured DNS endpoints.
 *
 * <p>With fewer than two active, multi-endpoint-enabled endpoints only the default endpoint
 * is called. Otherwise every active endpoint whose circuit allows it is called concurrently;
 * endpoints with an open circuit are left out of the result entirely. Per-endpoint failures
 * become failed outcomes. Only a registry failure is thrown to the caller.
 *
 * <p>Both modes run each endpoint call on a worker of {@code fanOutExecutor} and bound the
 * whole operation by {@code dnsmate.fanout.timeout}.
 */
@Service
public class MultiEndpointOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MultiEndpointOrchestrator.class);

    static final String NO_DEFAULT_ENDPOINT_NAME = "No default endpoint";
    static final String NO_DEFAULT_ENDPOINT_ERROR = "No default DNS endpoint configured";

    private final EndpointRegistry endpointRegistry;
    private final DnsEndpointClientFactory clientFactory;
    private final CircuitBreakerRegistry circuitBreakers;
    private final PerformanceMetrics performanceMetrics;
    private final ExecutorService executor;
    private final Duration fanOutTimeout;

    public MultiEndpointOrchestrator(
            EndpointRegistry endpointRegistry,
            DnsEndpointClientFactory clientFactory,
            CircuitBreakerRegistry circuitBreakers,
            PerformanceMetrics performanceMetrics,
            @Qualifier("fanOutExecutor") ExecutorService executor,
            AppProperties properties
    ) {
        this.endpointRegistry = endpointRegistry;
        this.clientFactory = clientFactory;
        this.circuitBreakers = circuitBreakers;
        this.performanceMetrics = performanceMetrics;
        this.executor = executor;
        this.fanOutTimeout = properties.fanout().timeout();
    }

    public AggregatedResult createZoneOnAll(ZoneSpec zone) {
        return executeOnAll("create_zone", client -> client.createZone(zone));
    }

    public AggregatedResult deleteZoneFromAll(String zoneName) {
        return executeOnAll("delete_zone", client -> {
            client.deleteZone(zoneName);
            return null;
        });
    }

    public AggregatedResult addRecordToAll(String zoneName, RecordSpec record) {
        return executeOnAll("add_record", client -> client.addRecord(zoneName, record));
    }

    public AggregatedResult updateRecordOnAll(String zoneName, RecordSpec record) {
        return executeOnAll("update_record", client -> client.updateRecord(zoneName, record));
    }

    public AggregatedResult deleteRecordFromAll(String zoneName, String recordName, String recordType) {
        return executeOnAll("delete_record", client -> {
            client.deleteRecord(zoneName, recordName, recordType);
            return null;
        });
    }

    public AggregatedResult executeOnAll(String operation, EndpointOperation endpointOperation) {
        long started = System.nanoTime();
        List<Endpoint> endpoints = loadEndpoints();

        if (!isMultiEndpointMode(endpoints)) {
            return executeOnDefault(operation, endpointOperation, started);
        }

        List<Endpoint> targets = new ArrayList<>();
        for (Endpoint endpoint : endpoints) {
            if (!endpoint.active()) continue;
            if (circuitBreakers.forEndpoint(endpoint.id()).canExecute()) {
                targets.add(endpoint);
            } else {
                log.warn("Endpoint {} circuit breaker is open, skipping", endpoint.name());
            }
        }

        if (targets.isEmpty()) {
            log.warn("No eligible DNS endpoints for operation={}", operation);
            return AggregatedResult.empty(operation, elapsedMs(started));
        }

        List<OperationOutcome> outcomes = fanOut(operation, endpointOperation, targets);
        AggregatedResult result = new AggregatedResult(operation, outcomes, elapsedMs(started));
        log.info("Multi-endpoint operation={} completed: {}/{} succeeded in {}ms",
                operation, result.successCount(), result.total(), result.executionTimeMs());
        return result;
    }

    public boolean isMultiEndpointMode() {
        return isMultiEndpointMode(loadEndpoints());
    }

    public FanOutHealthStatus getHealthStatus() {
        List<Endpoint> endpoints = loadEndpoints();
        Map<String, CircuitBreakerSnapshot> breakers = new LinkedHashMap<>();
        Map<String, EndpointPerformance> performance = new LinkedHashMap<>();
        int active = 0;
        int healthy = 0;
        for (Endpoint endpoint : endpoints) {
            CircuitBreakerSnapshot snapshot = circuitBreakers.snapshot(endpoint.id());
            breakers.put(endpoint.name(), snapshot);
            performance.put(endpoint.name(), performanceMetrics.summary(endpoint.id()));
            if (!endpoint.active()) continue;
            active++;
            if (snapshot.state() == CircuitState.CLOSED) healthy++;
        }
        return new FanOutHealthStatus(endpoints.size(), active, healthy, isMultiEndpointMode(endpoints), breakers, performance);
    }

    public EndpointPerformance getPerformance(long endpointId) {
        return performanceMetrics.summary(endpointId);
    }

    private AggregatedResult executeOnDefault(String operation, EndpointOperation endpointOperation, long started) {
        Endpoint endpoint;
        try {
            endpoint = endpointRegistry.getDefaultEndpoint().orElse(null);
        } catch (EndpointRegistryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EndpointRegistryException("Unable to resolve default DNS endpoint", e);
        }

        if (endpoint == null) {
            log.warn("No default DNS endpoint configured, operation={} not executed", operation);
            OperationOutcome missing = OperationOutcome.failed(0, NO_DEFAULT_ENDPOINT_NAME, NO_DEFAULT_ENDPOINT_ERROR, 0);
            return new AggregatedResult(operation, List.of(missing), elapsedMs(started));
        }

        List<OperationOutcome> outcomes = fanOut(operation, endpointOperation, List.of(endpoint));
        return new AggregatedResult(operation, outcomes, elapsedMs(started));
    }

    /**
     * Runs every call on its own worker under one shared deadline. Calls still running at the
     * deadline are settled as timed out before their workers are interrupted, so the interrupt
     * can never overwrite the timeout outcome.
     */
    private List<OperationOutcome> fanOut(String operation, EndpointOperation endpointOperation, List<Endpoint> targets) {
        List<EndpointCall> calls = targets.stream()
                .map(endpoint -> new EndpointCall(operation, endpoint, endpointOperation))
                .toList();

        long deadline = System.nanoTime() + fanOutTimeout.toNanos();
        List<Future<OperationOutcome>> futures = new ArrayList<>(calls.size());
        for (EndpointCall call : calls) {
            futures.add(executor.submit(call));
        }

        String timeoutMessage = "Operation timed out after " + describe(fanOutTimeout);
        List<OperationOutcome> outcomes = new ArrayList<>(calls.size());
        boolean timedOut = false;
        boolean interrupted = false;
        for (int i = 0; i < calls.size(); i++) {
            EndpointCall call = calls.get(i);
            if (interrupted) {
                outcomes.add(call.abandon("Operation interrupted"));
                continue;
            }
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                outcomes.add(futures.get(i).get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                timedOut = true;
                outcomes.add(call.abandon(timeoutMessage));
            } catch (ExecutionException e) {
                outcomes.add(call.abandon("Unexpected error: " + e.getCause()));
            } catch (InterruptedException e) {
                interrupted = true;
                outcomes.add(call.abandon("Operation interrupted"));
            }
        }

        for (Future<OperationOutcome> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
        if (timedOut) {
            log.error("Operation={} timed out after {}", operation, describe(fanOutTimeout));
        }
        if (interrupted) {
            log.error("Operation={} interrupted", operation);
            Thread.currentThread().interrupt();
        }
        return outcomes;
    }

    private List<Endpoint> loadEndpoints() {
        try {
            List<Endpoint> endpoints = endpointRegistry.getEndpoints();
            return endpoints == null ? List.of() : endpoints;
        } catch (EndpointRegistryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EndpointRegistryException("Unable to load DNS endpoints", e);
        }
    }

    private static boolean isMultiEndpointMode(List<Endpoint> endpoints) {
        return endpoints.stream().filter(Endpoint::fanOutCandidate).count() > 1;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String describe(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    /**
     * One endpoint's share of a fan-out. Whoever settles first, the call itself or the
     * orchestrator abandoning it on timeout, decides the outcome and records it on the breaker.
     * A call abandoned before it started is reported but not charged to the breaker.
     */
    private final class EndpointCall implements Callable<OperationOutcome> {
        private final String operation;
        private final Endpoint endpoint;
        private final EndpointOperation endpointOperation;
        private final AtomicReference<OperationOutcome> settled = new AtomicReference<>();
        private final AtomicBoolean started = new AtomicBoolean();
        private final Map<String, String> mdc = MDC.getCopyOfContextMap();
        private volatile long startedNanos = System.nanoTime();

        private EndpointCall(String operation, Endpoint endpoint, EndpointOperation endpointOperation) {
            this.operation = operation;
            this.endpoint = endpoint;
            this.endpointOperation = endpointOperation;
        }

        @Override
        public OperationOutcome call() {
            if (settled.get() != null) {
                return settled.get();
            }
            started.set(true);
            startedNanos = System.nanoTime();
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (mdc != null) MDC.setContextMap(mdc);
            OperationOutcome outcome;
            try {
                JsonNode payload = endpointOperation.execute(clientFactory.clientFor(endpoint));
                outcome = OperationOutcome.succeeded(endpoint.id(), endpoint.name(), payload, elapsedMs(startedNanos));
            } catch (Exception e) {
                String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                outcome = OperationOutcome.failed(endpoint.id(), endpoint.name(), error, elapsedMs(startedNanos));
            }
            try {
                return settle(outcome, true);
            } finally {
                if (previous == null) MDC.clear();
                else MDC.setContextMap(previous);
            }
        }

        OperationOutcome abandon(String error) {
            boolean wasStarted = started.get();
            long elapsed = wasStarted ? elapsedMs(startedNanos) : 0;
            OperationOutcome outcome = OperationOutcome.failed(endpoint.id(), endpoint.name(), error, elapsed);
            if (!wasStarted && settled.get() == null) {
                log.warn("Operation {} on endpoint {} never started: {}", operation, endpoint.name(), error);
            }
            return settle(outcome, wasStarted);
        }

        private OperationOutcome settle(OperationOutcome outcome, boolean chargeBreaker) {
            if (settled.compareAndSet(null, outcome) && chargeBreaker) {
                CircuitBreaker breaker = circuitBreakers.forEndpoint(endpoint.id());
                if (outcome.success()) {
                    breaker.recordSuccess();
                    performanceMetrics.record(endpoint.id(), outcome.responseTimeMs());
                } else {
                    breaker.recordFailure();
                    log.error("Operation {} failed on endpoint {}: {}", operation, endpoint.name(), outcome.error());
                }
            }
            return settled.get();
        }
    }
}

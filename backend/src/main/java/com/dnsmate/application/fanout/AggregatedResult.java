/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Every per-endpoint outcome of one logical operation plus the derived classification.
 * The classification methods are read-only views and do not depend on outcome order.
 */
public record AggregatedResult(
        String operation,
        List<OperationOutcome> outcomes,
        long executionTimeMs
) {
    public AggregatedResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static AggregatedResult empty(String operation, long executionTimeMs) {
        return new AggregatedResult(operation, List.of(), executionTimeMs);
    }

    public int total() {
        return outcomes.size();
    }

    public int successCount() {
        return (int) outcomes.stream().filter(OperationOutcome::success).count();
    }

    public int failureCount() {
        return total() - successCount();
    }

    public boolean isCompleteSuccess() {
        return total() > 0 && successCount() == total();
    }

    public boolean isPartialSuccess() {
        int successes = successCount();
        return successes > 0 && successes < total();
    }

    public boolean isCompleteFailure() {
        return total() > 0 && failureCount() == total();
    }

    public boolean isNoOp() {
        return outcomes.isEmpty();
    }

    public double averageResponseTime() {
        return outcomes.stream().mapToLong(OperationOutcome::responseTimeMs).average().orElse(0.0);
    }

    public Optional<String> fastestSuccessfulEndpoint() {
        return outcomes.stream()
                .filter(OperationOutcome::success)
                .min(Comparator.comparingLong(OperationOutcome::responseTimeMs))
                .map(OperationOutcome::endpointName);
    }

    public List<OperationOutcome> failures() {
        return outcomes.stream().filter(o -> !o.success()).toList();
    }
}

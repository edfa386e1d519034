/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api.zones;

import com.dnsmate.application.fanout.AggregatedResult;
import com.dnsmate.application.fanout.OperationOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

/**
 * Wire view of an {@link AggregatedResult}.
 */
public record FanOutResponse(
        String operation,
        Status status,
        int totalEndpoints,
        int successCount,
        int failureCount,
        long executionTimeMs,
        double averageResponseTimeMs,
        String fastestEndpoint,
        List<OutcomeView> outcomes
) {
    public enum Status { SUCCESS, PARTIAL_SUCCESS, FAILURE, NO_OP }

    public static FanOutResponse from(AggregatedResult result) {
        Status status;
        if (result.isNoOp()) status = Status.NO_OP;
        else if (result.isCompleteSuccess()) status = Status.SUCCESS;
        else if (result.isPartialSuccess()) status = Status.PARTIAL_SUCCESS;
        else status = Status.FAILURE;

        return new FanOutResponse(
                result.operation(),
                status,
                result.total(),
                result.successCount(),
                result.failureCount(),
                result.executionTimeMs(),
                result.averageResponseTime(),
                result.fastestSuccessfulEndpoint().orElse(null),
                result.outcomes().stream().map(OutcomeView::from).toList()
        );
    }

    /**
     * 200 (or {@code successStatus}) when every endpoint succeeded, 207 on partial success, 502 otherwise.
     */
    public static ResponseEntity<FanOutResponse> toResponse(AggregatedResult result, HttpStatus successStatus) {
        FanOutResponse body = from(result);
        HttpStatus status = switch (body.status()) {
            case SUCCESS -> successStatus;
            case PARTIAL_SUCCESS -> HttpStatus.MULTI_STATUS;
            case FAILURE, NO_OP -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(body);
    }

    public record OutcomeView(
            long endpointId,
            String endpoint,
            boolean success,
            String error,
            long responseTimeMs,
            Instant timestamp,
            JsonNode payload
    ) {
        static OutcomeView from(OperationOutcome outcome) {
            return new OutcomeView(
                    outcome.endpointId(),
                    outcome.endpointName(),
                    outcome.success(),
                    outcome.error(),
                    outcome.responseTimeMs(),
                    outcome.timestamp(),
                    outcome.payload()
            );
        }
    }
}

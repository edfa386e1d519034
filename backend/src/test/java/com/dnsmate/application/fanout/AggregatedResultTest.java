/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregatedResultTest {
    @Test
    void oneFailureOutOfThreeIsPartialSuccess() {
        AggregatedResult result = new AggregatedResult("add_record", List.of(
                ok(1, "A", 50),
                failed(2, "B", "connection refused", 10),
                ok(3, "C", 200)
        ), 210);

        assertEquals(3, result.total());
        assertEquals(2, result.successCount());
        assertEquals(1, result.failureCount());
        assertTrue(result.isPartialSuccess());
        assertFalse(result.isCompleteSuccess());
        assertFalse(result.isCompleteFailure());
        assertEquals(Optional.of("A"), result.fastestSuccessfulEndpoint());
        assertEquals("connection refused", result.failures().get(0).error());
    }

    @Test
    void classificationIgnoresOutcomeOrder() {
        AggregatedResult forward = new AggregatedResult("op", List.of(ok(1, "A", 50), ok(2, "C", 200)), 0);
        AggregatedResult reversed = new AggregatedResult("op", List.of(ok(2, "C", 200), ok(1, "A", 50)), 0);

        assertEquals(forward.fastestSuccessfulEndpoint(), reversed.fastestSuccessfulEndpoint());
        assertEquals(forward.averageResponseTime(), reversed.averageResponseTime());
        assertTrue(reversed.isCompleteSuccess());
    }

    @Test
    void emptyResultIsNoOpAndNothingElse() {
        AggregatedResult result = AggregatedResult.empty("create_zone", 0);

        assertTrue(result.isNoOp());
        assertFalse(result.isCompleteSuccess());
        assertFalse(result.isPartialSuccess());
        assertFalse(result.isCompleteFailure());
        assertEquals(0.0, result.averageResponseTime());
        assertTrue(result.fastestSuccessfulEndpoint().isEmpty());
    }

    @Test
    void allFailedIsCompleteFailureWithoutFastest() {
        AggregatedResult result = new AggregatedResult("delete_zone", List.of(
                failed(1, "A", "HTTP 500: boom", 5),
                failed(2, "B", "timeout", 15)
        ), 15);

        assertTrue(result.isCompleteFailure());
        assertEquals(10.0, result.averageResponseTime());
        assertTrue(result.fastestSuccessfulEndpoint().isEmpty());
    }

    private static OperationOutcome ok(long id, String name, long ms) {
        return new OperationOutcome(id, name, true, null, null, ms, Instant.now());
    }

    private static OperationOutcome failed(long id, String name, String error, long ms) {
        return new OperationOutcome(id, name, false, null, error, ms, Instant.now());
    }
}

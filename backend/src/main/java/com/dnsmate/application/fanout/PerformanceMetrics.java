/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.application.fanout;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window of successful call latencies per endpoint.
 */
public class PerformanceMetrics {
    public static final int DEFAULT_WINDOW = 100;

    private final int window;
    private final Map<Long, Deque<Long>> latencies = new ConcurrentHashMap<>();

    public PerformanceMetrics(int window) {
        this.window = window < 1 ? DEFAULT_WINDOW : window;
    }

    public void record(long endpointId, long responseTimeMs) {
        Deque<Long> samples = latencies.computeIfAbsent(endpointId, id -> new ArrayDeque<>());
        synchronized (samples) {
            samples.addLast(responseTimeMs);
            while (samples.size() > window) {
                samples.removeFirst();
            }
        }
    }

    public EndpointPerformance summary(long endpointId) {
        Deque<Long> samples = latencies.get(endpointId);
        if (samples == null) return EndpointPerformance.none();
        List<Long> copy;
        synchronized (samples) {
            copy = List.copyOf(samples);
        }
        if (copy.isEmpty()) return EndpointPerformance.none();
        LongSummaryStatistics stats = copy.stream().mapToLong(Long::longValue).summaryStatistics();
        return new EndpointPerformance(stats.getAverage(), stats.getMin(), stats.getMax(), (int) stats.getCount());
    }

    public void forget(long endpointId) {
        latencies.remove(endpointId);
    }
}

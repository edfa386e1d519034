/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.config;

import com.dnsmate.application.fanout.CircuitBreakerRegistry;
import com.dnsmate.application.fanout.PerformanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class FanOutConfig {
    private static final Logger log = LoggerFactory.getLogger(FanOutConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(AppProperties properties, Clock clock) {
        AppProperties.CircuitBreakerPolicy policy = properties.fanout().circuitBreaker();
        log.info("Circuit breaker policy failureThreshold={} recoveryTimeout={}",
                policy.failureThreshold(), policy.recoveryTimeout());
        return new CircuitBreakerRegistry(policy.failureThreshold(), policy.recoveryTimeout(), clock);
    }

    @Bean
    public PerformanceMetrics performanceMetrics(AppProperties properties) {
        return new PerformanceMetrics(properties.fanout().metricsWindow());
    }

    /**
     * Grows on demand so a call never waits for a thread while its deadline runs. A hung
     * endpoint holds only its own worker.
     */
    @Bean(name = "fanOutExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor(AppProperties properties) {
        return elasticPool("dns-fanout-", properties.fanout().coreThreads());
    }

    @Bean(name = "healthCheckExecutor", destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor() {
        return elasticPool("dns-health-", 0);
    }

    private static ExecutorService elasticPool(String threadNamePrefix, int coreThreads) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix);
        threadFactory.setDaemon(true);
        return new ThreadPoolExecutor(coreThreads, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), threadFactory);
    }
}

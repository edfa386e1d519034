/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.dns;

import com.dnsmate.domain.model.Endpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link PowerDnsClient}s, sharing one {@link WebClient} per distinct
 * address / timeout / TLS policy combination.
 */
public class PowerDnsClientFactory implements DnsEndpointClientFactory {
    private static final Logger log = LoggerFactory.getLogger(PowerDnsClientFactory.class);
    private static final int CONNECT_TIMEOUT_MS = 5_000;
    private static final int MAX_IN_MEMORY_BYTES = 2 * 1024 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<ConnectionKey, WebClient> webClients = new ConcurrentHashMap<>();

    public PowerDnsClientFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DnsEndpointClient clientFor(Endpoint endpoint) {
        ConnectionKey key = new ConnectionKey(stripTrailingSlash(endpoint.apiUrl()), endpoint.timeout(), endpoint.verifySsl());
        WebClient webClient = webClients.computeIfAbsent(key, this::buildWebClient);
        return new PowerDnsClient(endpoint, webClient, objectMapper);
    }

    private WebClient buildWebClient(ConnectionKey key) {
        int connectTimeout = (int) Math.min(CONNECT_TIMEOUT_MS, key.timeout().toMillis());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .responseTimeout(key.timeout());
        if (!key.verifySsl() && key.baseUrl().startsWith("https")) {
            log.warn("TLS verification disabled for {}", key.baseUrl());
            SslContext insecure = insecureSslContext();
            httpClient = httpClient.secure(spec -> spec.sslContext(insecure));
        }

        return WebClient.builder()
                .baseUrl(key.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build())
                .build();
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("insecure TLS context setup failed", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url == null ? "" : url.replaceAll("/+$", "");
    }

    private record ConnectionKey(String baseUrl, Duration timeout, boolean verifySsl) {}
}

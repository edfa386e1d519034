/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.config;

import com.dnsmate.infrastructure.dns.DnsEndpointClientFactory;
import com.dnsmate.infrastructure.dns.PowerDnsClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebClientConfig {
    @Bean
    public DnsEndpointClientFactory dnsEndpointClientFactory(ObjectMapper objectMapper) {
        return new PowerDnsClientFactory(objectMapper);
    }
}

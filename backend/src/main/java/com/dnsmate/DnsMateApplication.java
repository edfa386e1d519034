/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DnsMateApplication {
    public static void main(String[] args) {
        SpringApplication.run(DnsMateApplication.class, args);
    }
}

/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.config;

import com.dnsmate.infrastructure.crypto.AesGcmCrypto;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Base64;

@Configuration
public class CryptoConfig {
    @Bean
    public AesGcmCrypto aesGcmCrypto(AppProperties properties) {
        String keyBase64 = properties.crypto() == null ? null : properties.crypto().encryptionKeyBase64();
        if (keyBase64 == null || keyBase64.isBlank()) {
            throw new IllegalStateException("Missing DNSMATE_ENCRYPTION_KEY_BASE64 (dnsmate.crypto.encryption-key-base64)");
        }
        return new AesGcmCrypto(Base64.getDecoder().decode(keyBase64.trim()));
    }
}

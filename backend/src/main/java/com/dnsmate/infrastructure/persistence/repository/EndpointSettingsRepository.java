/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.infrastructure.persistence.repository;

import com.dnsmate.infrastructure.persistence.entity.EndpointSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface EndpointSettingsRepository extends JpaRepository<EndpointSettingsEntity, Long> {
    List<EndpointSettingsEntity> findAllByOrderByIdAsc();

    Optional<EndpointSettingsEntity> findFirstByDefaultEndpointTrueAndActiveTrueOrderByIdAsc();

    Optional<EndpointSettingsEntity> findFirstByActiveTrueOrderByIdAsc();

    boolean existsByName(String name);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update EndpointSettingsEntity e set e.defaultEndpoint = false where e.defaultEndpoint = true")
    int clearDefaults();
}

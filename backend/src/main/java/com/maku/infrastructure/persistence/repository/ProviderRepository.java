/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.repository;

import com.maku.infrastructure.persistence.entity.ProviderEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProviderRepository extends JpaRepository<ProviderEntity, UUID> {
    Optional<ProviderEntity> findByProviderName(String providerName);

    boolean existsByProviderName(String providerName);

    List<ProviderEntity> findByActiveTrueOrderByPriorityAsc();

    List<ProviderEntity> findAllByOrderByPriorityAsc();
}

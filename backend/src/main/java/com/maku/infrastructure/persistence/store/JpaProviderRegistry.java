/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.store;

import com.maku.application.health.ProviderRef;
import com.maku.application.health.ProviderRegistry;
import com.maku.infrastructure.persistence.entity.ProviderEntity;
import com.maku.infrastructure.persistence.repository.ProviderRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaProviderRegistry implements ProviderRegistry {
    private final ProviderRepository providerRepository;

    public JpaProviderRegistry(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    @Override
    @Transactional
    public List<ProviderRef> listActiveProviders() {
        return providerRepository.findByActiveTrueOrderByPriorityAsc().stream()
                .map(p -> new ProviderRef(p.getId(), p.getProviderName()))
                .toList();
    }

    @Override
    @Transactional
    public Optional<UUID> findProviderId(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return providerRepository.findByProviderName(name.trim()).map(ProviderEntity::getId);
    }
}

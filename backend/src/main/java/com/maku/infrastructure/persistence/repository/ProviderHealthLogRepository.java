/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.repository;

import com.maku.infrastructure.persistence.entity.ProviderHealthLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProviderHealthLogRepository extends JpaRepository<ProviderHealthLogEntity, UUID> {
    @Query("""
            select l from ProviderHealthLogEntity l
            where l.providerId = :providerId
              and l.checkTime >= :from
            order by l.checkTime asc
            """)
    List<ProviderHealthLogEntity> findSince(
            @Param("providerId") UUID providerId,
            @Param("from") Instant from
    );
}

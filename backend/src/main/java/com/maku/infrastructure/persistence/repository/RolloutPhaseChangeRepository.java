/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.repository;

import com.maku.infrastructure.persistence.entity.RolloutPhaseChangeEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

public interface RolloutPhaseChangeRepository extends JpaRepository<RolloutPhaseChangeEntity, UUID> {
    @Query("""
            select c from RolloutPhaseChangeEntity c
            order by c.changedAt desc
            """)
    List<RolloutPhaseChangeEntity> findRecent(Pageable pageable);
}

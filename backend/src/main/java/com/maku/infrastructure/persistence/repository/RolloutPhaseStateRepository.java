/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.repository;

import com.maku.infrastructure.persistence.entity.RolloutPhaseStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RolloutPhaseStateRepository extends JpaRepository<RolloutPhaseStateEntity, String> {
}

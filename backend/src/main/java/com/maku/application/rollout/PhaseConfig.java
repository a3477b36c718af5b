/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.NftTier;
import com.maku.domain.model.RolloutPhase;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

public record PhaseConfig(
        RolloutPhase phase,
        boolean enabled,
        String description,
        Set<String> roles,
        Set<NftTier> tiers,
        ModelRouting models
) {
    public PhaseConfig {
        if (phase == null) throw new IllegalArgumentException("phase is required");
        Set<String> normalizedRoles = new LinkedHashSet<>();
        if (roles != null) {
            for (String role : roles) {
                String r = PhaseGate.normalizeRole(role);
                if (r != null) normalizedRoles.add(r);
            }
        }
        roles = Collections.unmodifiableSet(normalizedRoles);
        EnumSet<NftTier> tierCopy = EnumSet.noneOf(NftTier.class);
        if (tiers != null) tierCopy.addAll(tiers);
        tiers = Collections.unmodifiableSet(tierCopy);
        if (models == null) models = ModelRouting.empty();
    }

    public PhaseConfig withEnabled(boolean value) {
        return new PhaseConfig(phase, value, description, roles, tiers, models);
    }

    public PhaseConfig withModels(ModelRouting value) {
        return new PhaseConfig(phase, enabled, description, roles, tiers, value);
    }
}

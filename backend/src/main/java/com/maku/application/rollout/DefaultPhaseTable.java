/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.NftTier;
import com.maku.domain.model.RolloutPhase;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

final class DefaultPhaseTable {
    private static final Set<String> ADMINS = Set.of("admin", "superadmin");
    private static final Set<String> EVERYONE = Set.of("admin", "superadmin", "partner", "user");

    private DefaultPhaseTable() {}

    static Map<RolloutPhase, PhaseConfig> build() {
        ModelRouting adminOnlyModels = new ModelRouting("gpt-4o", PhaseGate.FALLBACK_MODEL, Map.of());

        Map<NftTier, String> tierModels = new EnumMap<>(NftTier.class);
        tierModels.put(NftTier.PLATINUM, "o1");
        tierModels.put(NftTier.GOLD, "gpt-4o");
        tierModels.put(NftTier.SILVER, "gpt-4o-mini");
        tierModels.put(NftTier.BRONZE, "gpt-4o-mini");
        ModelRouting tieredModels = new ModelRouting("gpt-4o", PhaseGate.FALLBACK_MODEL, tierModels);

        Map<RolloutPhase, PhaseConfig> table = new EnumMap<>(RolloutPhase.class);
        table.put(RolloutPhase.DISABLED, new PhaseConfig(
                RolloutPhase.DISABLED,
                false,
                "AI features switched off for everyone",
                Set.of(),
                Set.of(),
                new ModelRouting(null, PhaseGate.FALLBACK_MODEL, Map.of())
        ));
        table.put(RolloutPhase.ADMIN_ONLY, new PhaseConfig(
                RolloutPhase.ADMIN_ONLY,
                true,
                "Internal testing by administrators",
                ADMINS,
                Set.of(),
                adminOnlyModels
        ));
        table.put(RolloutPhase.NFT_HOLDERS, new PhaseConfig(
                RolloutPhase.NFT_HOLDERS,
                true,
                "Administrators and NFT holders of any tier",
                ADMINS,
                EnumSet.allOf(NftTier.class),
                tieredModels
        ));
        table.put(RolloutPhase.ALL_USERS, new PhaseConfig(
                RolloutPhase.ALL_USERS,
                true,
                "General availability",
                EVERYONE,
                EnumSet.allOf(NftTier.class),
                tieredModels
        ));
        return table;
    }
}

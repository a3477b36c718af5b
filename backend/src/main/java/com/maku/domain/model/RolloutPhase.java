/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.domain.model;

import java.util.Optional;

public enum RolloutPhase {
    DISABLED("disabled"),
    ADMIN_ONLY("admin_only"),
    NFT_HOLDERS("nft_holders"),
    ALL_USERS("all_users");

    private final String id;

    RolloutPhase(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<RolloutPhase> fromId(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        for (RolloutPhase phase : values()) {
            if (phase.id.equalsIgnoreCase(v)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}

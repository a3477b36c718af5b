/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.domain.model;

import java.util.Optional;

public enum NftTier {
    BRONZE("Bronze"),
    SILVER("Silver"),
    GOLD("Gold"),
    PLATINUM("Platinum");

    private final String label;

    NftTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<NftTier> fromLabel(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        for (NftTier tier : values()) {
            if (tier.label.equalsIgnoreCase(v) || tier.name().equalsIgnoreCase(v)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}

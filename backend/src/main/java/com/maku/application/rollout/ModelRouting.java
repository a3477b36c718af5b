/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

import com.maku.domain.model.NftTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Model selection table of a rollout phase: the two reserved keys {@code admin} and
 * {@code default} plus one optional entry per {@link NftTier}.
 */
public record ModelRouting(
        String adminModel,
        String defaultModel,
        Map<NftTier, String> tierModels
) {
    public static final String ADMIN_KEY = "admin";
    public static final String DEFAULT_KEY = "default";

    public ModelRouting {
        EnumMap<NftTier, String> copy = new EnumMap<>(NftTier.class);
        if (tierModels != null) copy.putAll(tierModels);
        tierModels = Collections.unmodifiableMap(copy);
    }

    public static ModelRouting empty() {
        return new ModelRouting(null, null, Map.of());
    }

    public static ModelRouting fromMap(Map<String, String> models) {
        return empty().merge(models);
    }

    public Optional<String> forTier(NftTier tier) {
        return tier == null ? Optional.empty() : Optional.ofNullable(tierModels.get(tier));
    }

    /**
     * Partial update: keys that are not mentioned keep their current model. All keys are
     * validated before anything is applied.
     *
     * @throws IllegalArgumentException on an unknown key or a blank model name
     */
    public ModelRouting merge(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;

        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            String key = entry.getKey();
            if (!isReservedKey(key) && NftTier.fromLabel(key).isEmpty()) {
                throw new IllegalArgumentException("Unknown model key: " + key);
            }
            String value = entry.getValue();
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Model for key " + key + " must not be blank");
            }
        }

        String admin = adminModel;
        String fallback = defaultModel;
        EnumMap<NftTier, String> tiers = new EnumMap<>(NftTier.class);
        tiers.putAll(tierModels);
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            String key = entry.getKey().trim();
            String value = entry.getValue().trim();
            if (ADMIN_KEY.equalsIgnoreCase(key)) {
                admin = value;
            } else if (DEFAULT_KEY.equalsIgnoreCase(key)) {
                fallback = value;
            } else {
                tiers.put(NftTier.fromLabel(key).orElseThrow(), value);
            }
        }
        return new ModelRouting(admin, fallback, tiers);
    }

    /**
     * Wire form keyed by {@code admin}, {@code default} and tier labels; unset keys are omitted.
     */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        if (adminModel != null) out.put(ADMIN_KEY, adminModel);
        if (defaultModel != null) out.put(DEFAULT_KEY, defaultModel);
        for (Map.Entry<NftTier, String> entry : tierModels.entrySet()) {
            out.put(entry.getKey().label(), entry.getValue());
        }
        return out;
    }

    private static boolean isReservedKey(String key) {
        if (key == null) return false;
        String k = key.trim();
        return ADMIN_KEY.equalsIgnoreCase(k) || DEFAULT_KEY.equalsIgnoreCase(k);
    }
}

/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.domain.model;

public enum UserRole {
    USER,
    PARTNER,
    ADMIN,
    SUPERADMIN;

    /**
     * Lower-case identifier used by the rollout gate ("admin", "user", ...).
     */
    public String id() {
        return name().toLowerCase();
    }
}

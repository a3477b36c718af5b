/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.rollout;

/**
 * Identity lookups feeding the rollout gate. Unknown principals resolve to {@code null}.
 */
public interface EntitlementSource {
    String roleOf(String principal);

    String tierOf(String principal);
}

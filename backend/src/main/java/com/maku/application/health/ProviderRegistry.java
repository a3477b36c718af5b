/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProviderRegistry {
    List<ProviderRef> listActiveProviders();

    Optional<UUID> findProviderId(String name);
}

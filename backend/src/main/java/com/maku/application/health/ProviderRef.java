/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application.health;

import java.util.UUID;

public record ProviderRef(UUID id, String name) {}

/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.security;

import com.maku.domain.model.UserRole;

public record JwtPrincipal(String email, UserRole role) {}

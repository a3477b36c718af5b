/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}

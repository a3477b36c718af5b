/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.domain.model;

public enum ProviderType {
    FLIGHT,
    HOTEL,
    ACTIVITY,
    CAR
}

/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.config;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class RequestIdFilterTest {
    @Test
    void keepsWellFormedCallerId() {
        assertEquals("checkout-7f3a.1", RequestIdFilter.resolve("checkout-7f3a.1"));
    }

    @Test
    void replacesMissingOrUnsafeIds() {
        String forged = "abc\nWARN forged line";
        String tooLong = "a".repeat(129);

        assertDoesNotThrow(() -> UUID.fromString(RequestIdFilter.resolve(null)));
        assertDoesNotThrow(() -> UUID.fromString(RequestIdFilter.resolve("")));
        assertNotEquals(forged, RequestIdFilter.resolve(forged));
        assertNotEquals(tooLong, RequestIdFilter.resolve(tooLong));
    }
}

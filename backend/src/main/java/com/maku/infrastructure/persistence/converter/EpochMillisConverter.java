/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;

/**
 * Every timestamp column ({@code created_at}, {@code changed_at}, {@code check_time}, ...) is an
 * INTEGER of epoch milliseconds. Applied to all {@link Instant} attributes.
 */
@Converter(autoApply = true)
public class EpochMillisConverter implements AttributeConverter<Instant, Long> {
    @Override
    public Long convertToDatabaseColumn(Instant instant) {
        if (instant == null) return null;
        return instant.toEpochMilli();
    }

    @Override
    public Instant convertToEntityAttribute(Long millis) {
        if (millis == null) return null;
        return Instant.ofEpochMilli(millis);
    }
}

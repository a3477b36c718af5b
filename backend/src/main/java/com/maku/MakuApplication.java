/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MakuApplication {
    public static void main(String[] args) {
        SpringApplication.run(MakuApplication.class, args);
    }
}

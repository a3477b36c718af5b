/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api.admin;

import com.maku.application.UserEntitlementService;
import com.maku.domain.model.UserRole;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/users")
public class UserAdminController {
    private final UserEntitlementService entitlementService;

    public UserAdminController(UserEntitlementService entitlementService) {
        this.entitlementService = entitlementService;
    }

    @GetMapping("/{email}/entitlements")
    public UserEntitlementService.UserEntitlementView get(@PathVariable String email) {
        return entitlementService.get(email);
    }

    @PatchMapping("/{email}/entitlements")
    public UserEntitlementService.UserEntitlementView update(
            @PathVariable String email,
            @Valid @RequestBody UpdateEntitlementsRequest req
    ) {
        UserRole role = null;
        if (req.role() != null && !req.role().isBlank()) {
            role = parseRole(req.role());
        }
        return entitlementService.updateEntitlements(email, role, req.tier());
    }

    private static UserRole parseRole(String value) {
        try {
            return UserRole.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown role: " + value, e);
        }
    }

    public record UpdateEntitlementsRequest(String role, String tier) {}
}

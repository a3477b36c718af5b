/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.config;

import com.maku.domain.model.UserRole;
import com.maku.infrastructure.security.JwtService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class JwtAuthenticationFilterTest {
    private static final String SECRET = "filter-test-secret-filter-test-secret-0001";

    private JwtService jwtService;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(properties(SECRET), Clock.systemUTC());
        filter = new JwtAuthenticationFilter(jwtService);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void bearerTokenAuthenticatesWithRoleAuthority() throws Exception {
        String token = jwtService.mint("ops@maku.test", UserRole.SUPERADMIN);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/admin/rollout/status");
        request.addHeader("Authorization", "Bearer " + token);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertNotNull(auth);
        assertEquals("ops@maku.test", auth.getName());
        assertEquals(List.of("ROLE_SUPERADMIN"), auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).toList());
    }

    @Test
    void tokenSignedWithOtherKeyIsIgnored() throws Exception {
        JwtService other = new JwtService(properties("another-secret-another-secret-another-0002"), Clock.systemUTC());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/ai/access");
        request.addHeader("Authorization", "Bearer " + other.mint("eve@maku.test", UserRole.ADMIN));

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void expiredTokenIsIgnored() throws Exception {
        Clock past = Clock.fixed(Instant.parse("2020-01-01T00:00:00Z"), ZoneOffset.UTC);
        String token = new JwtService(properties(SECRET), past).mint("old@maku.test", UserRole.USER);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/ai/access");
        request.addHeader("Authorization", "Bearer " + token);

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    private static AppProperties properties(String secret) {
        return new AppProperties(new AppProperties.Jwt(secret, 3600), null, null, null);
    }
}

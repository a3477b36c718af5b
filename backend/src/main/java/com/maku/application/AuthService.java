/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.application;

import com.maku.api.ApiException;
import com.maku.config.AppProperties;
import com.maku.domain.model.NftTier;
import com.maku.domain.model.UserRole;
import com.maku.infrastructure.persistence.entity.UserEntity;
import com.maku.infrastructure.persistence.repository.UserRepository;
import com.maku.infrastructure.security.JwtService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final AppProperties properties;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtService jwtService,
            AppProperties properties
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.properties = properties;
    }

    /**
     * Addresses listed in {@code app.auth.admin-emails} become admins; everyone else starts as a
     * user holding the entry tier.
     */
    @Transactional
    public AuthToken register(String email, String password) {
        String normalized = normalize(email);
        if (userRepository.existsByEmail(normalized)) {
            throw new ApiException(HttpStatus.CONFLICT, "EMAIL_TAKEN", "email already exists");
        }
        boolean admin = properties.auth() != null && properties.auth().isAdminEmail(normalized);

        UserEntity user = new UserEntity();
        user.setEmail(normalized);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setRole(admin ? UserRole.ADMIN : UserRole.USER);
        user.setNftTier(admin ? null : NftTier.BRONZE);
        userRepository.save(user);
        log.info("User registered role={}", user.getRole());
        return token(user);
    }

    @Transactional
    public AuthToken login(String email, String password) {
        UserEntity user = userRepository.findByEmail(normalize(email))
                .orElseThrow(() -> new ApiException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "invalid credentials"));
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new ApiException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "invalid credentials");
        }
        return token(user);
    }

    private AuthToken token(UserEntity user) {
        return new AuthToken(
                jwtService.mint(user.getEmail(), user.getRole()),
                user.getRole(),
                user.getNftTier(),
                jwtService.ttlSeconds()
        );
    }

    private static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    public record AuthToken(String token, UserRole role, NftTier tier, long expiresInSeconds) {}
}

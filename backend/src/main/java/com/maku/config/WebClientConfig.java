/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {
    static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public WebClient healthProbeWebClient(AppProperties properties) {
        Duration timeout = probeTimeout(properties);
        long timeoutMs = timeout.toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, 5_000))
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return WebClient.builder()
                .defaultHeader("User-Agent", "maku-health-monitor")
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(64 * 1024))
                        .build())
                .build();
    }

    static Duration probeTimeout(AppProperties properties) {
        if (properties.health() == null || properties.health().probe() == null) return DEFAULT_PROBE_TIMEOUT;
        Duration configured = properties.health().probe().timeout();
        return configured == null || configured.isZero() || configured.isNegative() ? DEFAULT_PROBE_TIMEOUT : configured;
    }
}

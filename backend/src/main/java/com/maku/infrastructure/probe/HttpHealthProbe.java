/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.infrastructure.probe;

import com.maku.application.health.HealthProbe;
import com.maku.application.health.ProbeResult;
import com.maku.config.AppProperties;
import com.maku.domain.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes each configured provider health URL with a plain GET, one after another.
 *
 * <p>A 2xx answer within the degraded threshold is healthy, a slower 2xx is degraded.
 * Any other status, a timeout or a transport error is unhealthy. A failure for one target
 * never prevents the remaining targets from being probed.
 */
@Component
public class HttpHealthProbe implements HealthProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_DEGRADED_THRESHOLD = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final Map<String, String> targets;
    private final Duration timeout;
    private final Duration degradedThreshold;

    public HttpHealthProbe(@Qualifier("healthProbeWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        AppProperties.Health.Probe probe = properties.health() == null ? null : properties.health().probe();
        this.targets = probe == null || probe.targets() == null ? Map.of() : new LinkedHashMap<>(probe.targets());
        this.timeout = probe == null || probe.timeout() == null ? DEFAULT_TIMEOUT : probe.timeout();
        this.degradedThreshold = probe == null || probe.degradedThreshold() == null
                ? DEFAULT_DEGRADED_THRESHOLD
                : probe.degradedThreshold();
    }

    @Override
    public Map<String, ProbeResult> checkAll() {
        Map<String, ProbeResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, String> target : targets.entrySet()) {
            results.put(target.getKey(), probe(target.getKey(), target.getValue()));
        }
        log.debug("Probed providers count={}", results.size());
        return results;
    }

    ProbeResult probe(String provider, String url) {
        long started = System.nanoTime();
        try {
            HttpStatusCode status = webClient.get()
                    .uri(url)
                    .exchangeToMono(res -> res.releaseBody().thenReturn(res.statusCode()))
                    .timeout(timeout)
                    .block();
            long latencyMs = elapsedMs(started);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("url", url);
            if (status == null) {
                return new ProbeResult(HealthStatus.UNHEALTHY, latencyMs, "empty response", metadata);
            }
            metadata.put("httpStatus", status.value());

            if (!status.is2xxSuccessful()) {
                return new ProbeResult(HealthStatus.UNHEALTHY, latencyMs, "HTTP " + status.value(), metadata);
            }
            if (latencyMs > degradedThreshold.toMillis()) {
                return new ProbeResult(HealthStatus.DEGRADED, latencyMs, "slow response", metadata);
            }
            return new ProbeResult(HealthStatus.HEALTHY, latencyMs, null, metadata);
        } catch (RuntimeException e) {
            long latencyMs = elapsedMs(started);
            log.warn("Health probe failed provider={} url={} error={}", provider, url, e.toString());
            String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new ProbeResult(HealthStatus.UNHEALTHY, latencyMs, detail, Map.of("url", url));
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}

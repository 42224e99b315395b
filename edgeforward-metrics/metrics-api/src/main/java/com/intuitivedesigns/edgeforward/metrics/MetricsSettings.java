/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_STEP_SECONDS = "metrics.step.seconds";
    private static final String KEY_COLLECT_SECONDS = "metrics.collect.interval.seconds";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";

    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 10;
    private static final int DEFAULT_COLLECT_SECONDS = 10;
    private static final int DEFAULT_PROM_PORT = 9090;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;
    public final Duration collectInterval;
    /** 0 binds an ephemeral port. */
    public final int prometheusPort;

    private MetricsSettings(String providerId,
                            Map<String, String> commonTags,
                            Duration step,
                            Duration collectInterval,
                            int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
        this.collectInterval = collectInterval;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(ForwarderConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));
        final Duration step = Duration.ofSeconds(clampInt(config.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600));
        final Duration collect = Duration.ofSeconds(clampInt(config.getInt(KEY_COLLECT_SECONDS, DEFAULT_COLLECT_SECONDS), 1, 3_600));

        final Map<String, String> tags = new HashMap<>();
        for (Map.Entry<String, String> entry : config.subset(KEY_TAG_PREFIX).entrySet()) {
            final String tagKey = normalize(entry.getKey());
            final String tagVal = normalize(entry.getValue());
            if (tagKey != null && tagVal != null) tags.put(tagKey, tagVal);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);

        return new MetricsSettings(
                (provider != null) ? provider : DEFAULT_PROVIDER,
                Collections.unmodifiableMap(tags),
                step,
                collect,
                promPort
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                ", collectInterval=" + collectInterval +
                ", prometheusPort=" + prometheusPort +
                '}';
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsSettingsTest {

    @Test
    void from_shouldApplyDefaults() {
        MetricsSettings s = MetricsSettings.from(ForwarderConfig.fromMap(Map.of()));

        assertEquals("NONE", s.providerId);
        assertEquals(Duration.ofSeconds(10), s.step);
        assertEquals(Duration.ofSeconds(10), s.collectInterval);
        assertEquals(9090, s.prometheusPort);
        assertTrue(s.commonTags.isEmpty());
    }

    @Test
    void from_shouldReadProviderAndTags() {
        MetricsSettings s = MetricsSettings.from(ForwarderConfig.fromMap(Map.of(
                "metrics.provider", " prometheus ",
                "metrics.collect.interval.seconds", "0",
                "metrics.tag.site", "plant-7",
                "metrics.tag.blank", " ")));

        assertEquals("PROMETHEUS", s.providerId);
        assertEquals(Duration.ofSeconds(1), s.collectInterval);
        assertEquals(Map.of("site", "plant-7"), s.commonTags);
    }

    @Test
    void init_withoutMatchingProviderShouldReturnNoop() {
        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(ForwarderConfig.fromMap(Map.of())));

        assertSame(MetricsFactory.noop(), rt);
        assertFalse(rt.enabled());
        assertNotNull(rt.registry());
    }
}

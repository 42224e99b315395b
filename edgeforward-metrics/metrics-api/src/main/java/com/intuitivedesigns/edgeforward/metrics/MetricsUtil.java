/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import io.micrometer.core.instrument.MeterRegistry;

public final class MetricsUtil {

    private MetricsUtil() {}

    /**
     * Apply common tags from settings to a Micrometer registry.
     */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null) return;
        registry.config().commonTags(MicrometerMetricsRuntime.toTags(settings.commonTags));
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import java.util.Map;
import java.util.Objects;

/**
 * One value reported by a target writer.
 * COUNTER values are increments since the previous collection, GAUGE values are absolute.
 */
public record MetricsDataPoint(String name, Kind kind, double value, Map<String, String> dimensions) {

    public enum Kind { COUNTER, GAUGE }

    public MetricsDataPoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        dimensions = (dimensions == null) ? Map.of() : Map.copyOf(dimensions);
    }

    public static MetricsDataPoint counter(String name, double increment) {
        return new MetricsDataPoint(name, Kind.COUNTER, increment, Map.of());
    }

    public static MetricsDataPoint gauge(String name, double value) {
        return new MetricsDataPoint(name, Kind.GAUGE, value, Map.of());
    }
}

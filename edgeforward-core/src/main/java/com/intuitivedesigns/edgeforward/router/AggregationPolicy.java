/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;

/**
 * How per-route results combine into the result reported upstream.
 */
public enum AggregationPolicy {
    /** Every route must succeed. */
    ALL_TARGETS,
    /** At least one route must succeed. */
    ANY_TARGET;

    public boolean combine(Collection<Boolean> routeResults) {
        if (routeResults == null || routeResults.isEmpty()) return false;
        return switch (this) {
            case ALL_TARGETS -> routeResults.stream().allMatch(Boolean.TRUE::equals);
            case ANY_TARGET -> routeResults.stream().anyMatch(Boolean.TRUE::equals);
        };
    }

    public static AggregationPolicy parse(String value, String configKey) {
        if (value == null || value.isBlank()) return ALL_TARGETS;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid '" + configKey + "=" + value + "'. Available options: "
                    + Arrays.toString(values()), configKey, e);
        }
    }
}

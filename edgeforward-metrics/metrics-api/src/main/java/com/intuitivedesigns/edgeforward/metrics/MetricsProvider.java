/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

/**
 * Service Provider Interface (SPI) for Metrics implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.edgeforward.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "PROMETHEUS", "NOOP").
     * <p>Matched against the {@code metrics.provider} configuration.
     */
    String id();

    /**
     * Creates a runtime instance for this provider if the settings match.
     *
     * @return a {@link MetricsRuntime} if this provider is selected, or {@code null} to be skipped.
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}

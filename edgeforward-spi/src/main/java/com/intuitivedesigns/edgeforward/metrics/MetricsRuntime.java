/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import java.util.Map;

/**
 * Vendor-agnostic metrics contract.
 *
 * The forwarding core records through this interface only, so it runs unchanged
 * with the NOOP defaults when no metrics backend is configured.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name, double increment, Map<String, String> tags) {}

    default void gauge(String name, double value, Map<String, String> tags) {}

    @Override
    default void close() {
        // no-op by default
    }
}

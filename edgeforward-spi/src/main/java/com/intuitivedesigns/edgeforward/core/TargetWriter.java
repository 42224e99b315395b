/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProvider;

/**
 * A downstream destination for collected data.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #writeTargetData(DataUnit)} may return before delivery is confirmed. Writers that
 * were given a {@link TargetResultHandler} report the confirmation later as a {@link TargetResult}.</li>
 * <li>Throwing from {@link #writeTargetData(DataUnit)} signals an immediate delivery failure.</li>
 * <li>Implementations must be thread-safe; forward attempts for different units may overlap.</li>
 * </ul>
 */
public interface TargetWriter extends AutoCloseable {

    void writeTargetData(DataUnit unit) throws Exception;

    /**
     * @return false while the writer cannot accept data yet (connecting, authenticating).
     * Forwarding to an uninitialized writer fails immediately.
     */
    default boolean isInitialized() {
        return true;
    }

    /**
     * @return the writer's metrics source, or {@code null} when it does not produce metrics.
     */
    default TargetMetricsProvider metricsProvider() {
        return null;
    }

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}

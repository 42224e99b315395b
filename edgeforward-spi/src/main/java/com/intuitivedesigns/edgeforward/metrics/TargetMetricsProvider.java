/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import java.util.List;

/**
 * Source of writer-level metrics, polled periodically by the metrics processor.
 */
@FunctionalInterface
public interface TargetMetricsProvider {

    /**
     * @return data points since the last call; never null.
     */
    List<MetricsDataPoint> collect();
}

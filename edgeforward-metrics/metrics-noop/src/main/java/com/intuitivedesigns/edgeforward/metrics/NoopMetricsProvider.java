/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // only when 'metrics.provider=NOOP' is requested explicitly
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return NoopMetricsRuntime.INSTANCE;
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }

        @Override public boolean enabled() { return false; }
        @Override public String type() { return "NOOP"; }
    }
}

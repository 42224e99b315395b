/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final MetricsRuntime NOOP = new NoopMetricsRuntime();

    private MetricsFactory() {}

    /**
     * Returns the runtime of the first provider that accepts the settings, or a NOOP runtime.
     */
    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());

        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // Throwable, so a provider with missing dependencies (LinkageError) is skipped too
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("Metrics disabled or no suitable provider found for '{}' (NOOP active).", settings.providerId);
        return NOOP;
    }

    public static MetricsRuntime noop() {
        return NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        // sentinel instead of null for "instanceof" checks downstream
        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.app;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.metrics.MetricsFactory;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.metrics.MetricsSettings;
import com.intuitivedesigns.edgeforward.router.RouterTargetWriter;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

public final class EdgeForwardApp {

    private static final Logger log = LoggerFactory.getLogger(EdgeForwardApp.class);

    // --- Config Keys ---
    static final String CFG_ROUTER_ID = "router.id";

    private EdgeForwardApp() {}

    public static void main(String[] args) {
        log.info("=== Booting EdgeForward ===");

        MetricsRuntime metrics = null;
        RouterTargetWriter router = null;
        SyntheticScheduleSource source = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            final ForwarderConfig config = ForwarderConfig.load();

            // 1. Initialize Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Discover writer plugins
            final ServicePluginRegistry<WriterFactory> writers = new ServicePluginRegistry<>(WriterFactory.class);
            log.info("Writer plugins available: {}", writers.availableIds());

            // 3. Build the router
            final String routerId = config.getString(CFG_ROUTER_ID, null);
            if (routerId == null) {
                throw new ConfigurationException("No router configured", CFG_ROUTER_ID);
            }
            final LoggingResultHandler upstream = new LoggingResultHandler();
            router = new RouterTargetWriter(routerId, config, writers, metrics, upstream);

            // 4. Optional synthetic input
            source = SyntheticScheduleSource.fromConfig(config, router);

            // 5. Setup Shutdown Hook
            final MetricsRuntime finalMetrics = metrics;
            final RouterTargetWriter finalRouter = router;
            final SyntheticScheduleSource finalSource = source;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                log.info("Shutdown signal received.");
                try {
                    closeQuietly(finalSource);
                    closeQuietly(finalRouter);
                    closeQuietly(finalMetrics);
                } finally {
                    log.info("Delivered={} Failed={}", upstream.ackedTotal(), upstream.failedTotal());
                    shutdownLatch.countDown();
                }
            }, "ef-shutdown"));

            // 6. Launch
            log.info("Starting router '{}'...", routerId);
            router.start();
            if (source != null) source.start();

            shutdownLatch.await();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                closeQuietly(source);
                closeQuietly(router);
                closeQuietly(metrics);
                shutdownLatch.countDown();
            }

            System.exit(1);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
        }
    }
}

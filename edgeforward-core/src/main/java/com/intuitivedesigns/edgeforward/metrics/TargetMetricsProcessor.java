/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import com.intuitivedesigns.edgeforward.core.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically pulls writer metrics and publishes them on the {@link MetricsRuntime}.
 *
 * <p>The scheduler is started by the first {@link #register} call, so a forwarder whose
 * targets expose no metrics never creates the thread.</p>
 */
public final class TargetMetricsProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TargetMetricsProcessor.class);

    public static final String CONFIG_COLLECT_INTERVAL = "metrics.collect.interval.seconds";
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
    public static final String TAG_SOURCE = "source";

    private final MetricsRuntime metrics;
    private final Duration interval;
    private final Map<String, TargetMetricsProvider> providers = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledExecutorService scheduler;

    public TargetMetricsProcessor(MetricsRuntime metrics, Duration interval) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(interval, "interval");
        this.interval = (interval.isZero() || interval.isNegative()) ? DEFAULT_INTERVAL : interval;
    }

    public void register(String sourceId, TargetMetricsProvider provider) {
        Objects.requireNonNull(sourceId, "sourceId");
        if (provider == null || closed.get()) return;

        providers.put(sourceId, provider);
        log.debug("Registered metrics provider for '{}'", sourceId);

        if (started.compareAndSet(false, true)) {
            final ScheduledExecutorService s =
                    Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("target-metrics"));
            final long millis = interval.toMillis();
            s.scheduleAtFixedRate(this::collect, millis, millis, TimeUnit.MILLISECONDS);
            this.scheduler = s;
            log.info("Target metrics processor started (interval={}s)", interval.toSeconds());
        }
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    public int providerCount() {
        return providers.size();
    }

    /**
     * Runs one collection cycle. A failing provider does not stop the others.
     */
    public void collect() {
        for (Map.Entry<String, TargetMetricsProvider> e : providers.entrySet()) {
            final String source = e.getKey();
            try {
                final List<MetricsDataPoint> points = e.getValue().collect();
                if (points == null) continue;
                for (MetricsDataPoint p : points) {
                    publish(source, p);
                }
            } catch (Exception ex) {
                log.warn("Collecting metrics from '{}' failed: {}", source, ex.toString());
            }
        }
    }

    private void publish(String source, MetricsDataPoint p) {
        final Map<String, String> tags = new HashMap<>(p.dimensions());
        tags.put(TAG_SOURCE, source);

        switch (p.kind()) {
            case COUNTER -> metrics.counter(p.name(), p.value(), tags);
            case GAUGE -> metrics.gauge(p.name(), p.value(), tags);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final ScheduledExecutorService s = scheduler;
        if (s != null) {
            s.shutdownNow();
            try {
                if (!s.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Target metrics processor did not terminate in time");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            // final flush so counters accumulated since the last tick are not lost
            collect();
        }
        providers.clear();
    }
}

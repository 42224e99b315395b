/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.app;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.NamedDaemonThreadFactory;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;

/**
 * Emits one synthetic reading per tick into a writer, standing in for the schedule
 * collectors that feed the router in a deployment.
 *
 * <pre>
 * source.synthetic.enabled=true
 * source.synthetic.schedule=synthetic
 * source.synthetic.interval.ms=1000
 * </pre>
 */
final class SyntheticScheduleSource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyntheticScheduleSource.class);

    static final String CFG_ENABLED = "source.synthetic.enabled";
    static final String CFG_SCHEDULE = "source.synthetic.schedule";
    static final String CFG_INTERVAL_MS = "source.synthetic.interval.ms";

    private static final String DEFAULT_SCHEDULE = "synthetic";
    private static final long DEFAULT_INTERVAL_MS = 1_000L;

    private final String scheduleName;
    private final long intervalMs;
    private final TargetWriter writer;
    private final LongAdder emitted = new LongAdder();

    private ScheduledExecutorService scheduler;

    SyntheticScheduleSource(String scheduleName, long intervalMs, TargetWriter writer) {
        this.scheduleName = Objects.requireNonNull(scheduleName, "scheduleName");
        this.intervalMs = Math.max(1L, intervalMs);
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /** Returns a source for the configured schedule, or null when the synthetic source is off. */
    static SyntheticScheduleSource fromConfig(ForwarderConfig config, TargetWriter writer) {
        if (!config.getBoolean(CFG_ENABLED, false)) return null;
        return new SyntheticScheduleSource(
                config.getString(CFG_SCHEDULE, DEFAULT_SCHEDULE),
                config.getLong(CFG_INTERVAL_MS, DEFAULT_INTERVAL_MS),
                writer);
    }

    synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("ef-synthetic"));
        scheduler.scheduleAtFixedRate(this::emitSafely, 0L, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Synthetic source active: schedule='{}' interval={}ms", scheduleName, intervalMs);
    }

    private void emitSafely() {
        try {
            emit();
        } catch (Exception e) {
            log.warn("Synthetic source emit failed", e);
        }
    }

    void emit() throws Exception {
        final double value = Math.round(ThreadLocalRandom.current().nextDouble(15.0, 30.0) * 100.0) / 100.0;
        final String payload = "{\"value\":" + value + "}";
        writer.writeTargetData(DataUnit.create(scheduleName, payload, Map.of("source", "synthetic"), false));
        emitted.increment();
    }

    long emittedTotal() {
        return emitted.sum();
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Synthetic source did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Synthetic source stopped after {} unit(s)", emitted.sum());
    }
}

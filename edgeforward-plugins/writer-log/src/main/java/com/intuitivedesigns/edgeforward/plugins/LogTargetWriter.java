/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.plugins;

import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsDataPoint;
import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

final class LogTargetWriter implements TargetWriter {

    private static final Logger log = LoggerFactory.getLogger(LogTargetWriter.class);

    static final String METRIC_MESSAGES = "writer.log.messages";

    private final String targetId;
    private final String level;
    private final int maxChars;
    private final boolean logPayload;
    private final TargetResultHelper results;

    private final LongAdder written = new LongAdder();
    private final LongAdder total = new LongAdder();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LogTargetWriter(String targetId, String level, int maxChars, boolean logPayload, TargetResultHelper results) {
        this.targetId = targetId;
        this.level = level;
        this.maxChars = maxChars;
        this.logPayload = logPayload;
        this.results = results;
        log.info("Log target '{}' initialized (level={}, maxChars={})", targetId, level, maxChars);
    }

    @Override
    public void writeTargetData(DataUnit unit) {
        if (unit == null) return;
        if (closed.get()) throw new IllegalStateException("Log target '" + targetId + "' is closed");

        if (shouldLog()) {
            final String content;
            if (logPayload) {
                final String raw = String.valueOf(unit.payload());
                content = (raw.length() > maxChars) ? raw.substring(0, maxChars) + "... [TRUNCATED]" : raw;
            } else {
                content = "[payload logging disabled]";
            }
            logAtLevel("[{}] serial={} schedule={} | {}", targetId, unit.serial(), unit.scheduleName(), content);
        }

        written.increment();
        total.increment();
        results.ack(unit);
    }

    @Override
    public boolean isInitialized() {
        return !closed.get();
    }

    @Override
    public TargetMetricsProvider metricsProvider() {
        return () -> List.of(MetricsDataPoint.counter(METRIC_MESSAGES, written.sumThenReset()));
    }

    long totalWritten() {
        return total.sum();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Log target '{}' closed after {} unit(s)", targetId, total.sum());
        }
    }

    private boolean shouldLog() {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "WARN" -> log.isWarnEnabled();
            case "INFO" -> log.isInfoEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF" -> false;
            default -> log.isInfoEnabled();
        };
    }

    private void logAtLevel(String fmt, Object... args) {
        switch (level) {
            case "ERROR" -> log.error(fmt, args);
            case "WARN" -> log.warn(fmt, args);
            case "DEBUG" -> log.debug(fmt, args);
            case "TRACE" -> log.trace(fmt, args);
            case "OFF" -> { }
            default -> log.info(fmt, args);
        }
    }
}

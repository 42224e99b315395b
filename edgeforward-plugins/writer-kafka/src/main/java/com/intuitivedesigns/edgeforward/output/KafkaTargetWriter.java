/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.output;

import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsDataPoint;
import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProvider;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Sends each unit as one record, keyed by its serial.
 *
 * Features:
 * - Asynchronous delivery results: the producer callback acks or errors the unit
 * - Units flagged noBuffering are flushed right after the send
 * - In-flight limit (semaphore-based backpressure)
 * - Rate-limited error logging
 */
final class KafkaTargetWriter implements TargetWriter {

    private static final Logger log = LoggerFactory.getLogger(KafkaTargetWriter.class);

    static final String HEADER_SCHEDULE = "edgeforward.schedule";
    static final String METRIC_SENT = "writer.kafka.sent";
    static final String METRIC_FAILED = "writer.kafka.failed";
    static final String METRIC_INFLIGHT = "writer.kafka.inflight";

    private final String targetId;
    private final String topic;
    private final Producer<String, String> producer;
    private final TargetResultHelper results;

    private final boolean backpressureEnabled;
    private final Semaphore inflightSemaphore;
    private final LongAdder inflightNow = new LongAdder();

    // deltas since the last metrics collection
    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    private final long errorLogIntervalMs;
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    KafkaTargetWriter(String targetId,
                      String topic,
                      Producer<String, String> producer,
                      TargetResultHelper results,
                      int maxInFlight,
                      long errorLogIntervalMs) {
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.results = Objects.requireNonNull(results, "results");
        this.errorLogIntervalMs = errorLogIntervalMs;

        if (maxInFlight > 0) {
            this.inflightSemaphore = new Semaphore(maxInFlight, false);
            this.backpressureEnabled = true;
        } else {
            this.inflightSemaphore = null;
            this.backpressureEnabled = false;
        }

        log.info("Kafka target '{}' active. topic='{}' inflight_limit={}",
                targetId, topic, backpressureEnabled ? maxInFlight : "unbounded");
    }

    /**
     * Hands the record to the producer. A send that fails before the producer accepted it throws;
     * everything after that is reported through the result handler.
     */
    @Override
    public void writeTargetData(DataUnit unit) throws InterruptedException {
        Objects.requireNonNull(unit, "unit");
        if (closed.get()) throw new IllegalStateException("Kafka target '" + targetId + "' is closed");

        if (backpressureEnabled) {
            inflightSemaphore.acquire();
            inflightNow.increment();
        }

        boolean callbackInstalled = false;
        try {
            final ProducerRecord<String, String> record =
                    new ProducerRecord<>(topic, unit.serialString(), String.valueOf(unit.payload()));
            record.headers().add(HEADER_SCHEDULE, unit.scheduleName().getBytes(StandardCharsets.UTF_8));
            for (Map.Entry<String, String> h : unit.metadata().entrySet()) {
                record.headers().add(h.getKey(), h.getValue().getBytes(StandardCharsets.UTF_8));
            }

            producer.send(record, (metadata, exception) -> {
                try {
                    if (exception == null) {
                        sentOk.increment();
                        results.ack(unit);
                    } else {
                        sentFail.increment();
                        logRateLimited("Kafka send failed target=" + targetId + " topic=" + topic, exception);
                        results.error(unit);
                    }
                } finally {
                    release();
                }
            });
            callbackInstalled = true;
        } catch (RuntimeException e) {
            sentFail.increment();
            logRateLimited("Kafka send rejected target=" + targetId + " topic=" + topic, e);
            throw e;
        } finally {
            if (!callbackInstalled) release();
        }

        // unbuffered units must not wait for linger.ms
        if (unit.noBuffering()) {
            producer.flush();
        }
    }

    private void release() {
        if (backpressureEnabled) {
            inflightNow.decrement();
            inflightSemaphore.release();
        }
    }

    private void logRateLimited(String context, Throwable ex) {
        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();

        if (now - last >= errorLogIntervalMs && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    @Override
    public boolean isInitialized() {
        return !closed.get();
    }

    @Override
    public TargetMetricsProvider metricsProvider() {
        return () -> List.of(
                MetricsDataPoint.counter(METRIC_SENT, sentOk.sumThenReset()),
                MetricsDataPoint.counter(METRIC_FAILED, sentFail.sumThenReset()),
                new MetricsDataPoint(METRIC_INFLIGHT, MetricsDataPoint.Kind.GAUGE, inflightNow.sum(), Map.of("topic", topic)));
    }

    /** Approximate number of records awaiting their callback. */
    long inFlightTotal() {
        return inflightNow.sum();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        log.info("Closing Kafka target '{}' (topic={})...", targetId, topic);
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Kafka target '{}' close failed", targetId, e);
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.targets;

import com.intuitivedesigns.edgeforward.channel.BoundedDeliveryChannel;
import com.intuitivedesigns.edgeforward.channel.SubmitResult;
import com.intuitivedesigns.edgeforward.channel.TuningChannelEventHandler;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetResultHandler;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProcessor;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.TargetException;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for writers that accept units and pass them on to their own sub-targets.
 *
 * <p>{@link #writeTargetData(DataUnit)} only enqueues. A single worker thread takes units in
 * submission order and hands each one to {@link #forwardTargetData(DataUnit)}. A unit that fails
 * there is logged and the worker moves on to the next one.</p>
 */
public abstract class ForwardingTargetWriter implements TargetWriter {

    private static final Logger log = LoggerFactory.getLogger(ForwardingTargetWriter.class);

    public static final String CONFIG_CHANNEL_SIZE = "tuning.forward.channel.size";
    public static final String CONFIG_CHANNEL_TIMEOUT = "tuning.forward.channel.timeout.ms";
    public static final int DEFAULT_CHANNEL_SIZE = 100;
    public static final long DEFAULT_CHANNEL_TIMEOUT_MS = 10_000L;

    private static final long WORKER_JOIN_TIMEOUT_MS = 5_000L;

    protected final String writerId;
    protected final ForwarderConfig config;
    protected final MetricsRuntime metrics;
    protected final ServicePluginRegistry<WriterFactory> writerFactories;
    protected final TargetMetricsProcessor metricsProcessor;
    protected final SubTargetRegistry registry;

    private final BoundedDeliveryChannel<DataUnit> channel;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread worker;

    protected ForwardingTargetWriter(String writerId,
                                     ForwarderConfig config,
                                     Collection<String> subTargetIds,
                                     ServicePluginRegistry<WriterFactory> writerFactories,
                                     MetricsRuntime metrics) {
        this.writerId = Objects.requireNonNull(writerId, "writerId");
        this.config = Objects.requireNonNull(config, "config");
        this.writerFactories = Objects.requireNonNull(writerFactories, "writerFactories");
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        this.metricsProcessor = new TargetMetricsProcessor(metrics,
                Duration.ofSeconds(config.getLong(TargetMetricsProcessor.CONFIG_COLLECT_INTERVAL,
                        TargetMetricsProcessor.DEFAULT_INTERVAL.toSeconds())));

        this.registry = new SubTargetRegistry(writerId,
                SubTargetRegistry.resolve(config, subTargetIds, writerFactories),
                this::createTargetWriter,
                metricsProcessor);

        final int size = Math.max(1, config.getInt(CONFIG_CHANNEL_SIZE, DEFAULT_CHANNEL_SIZE));
        final long timeoutMs = Math.max(0L, config.getLong(CONFIG_CHANNEL_TIMEOUT, DEFAULT_CHANNEL_TIMEOUT_MS));
        this.channel = new BoundedDeliveryChannel<>(writerId + "-forward", size, Duration.ofMillis(timeoutMs),
                new TuningChannelEventHandler(CONFIG_CHANNEL_SIZE, CONFIG_CHANNEL_TIMEOUT, log));
    }

    /**
     * Delivers one unit to the sub-targets. Runs on the worker thread, one unit at a time.
     */
    protected abstract void forwardTargetData(DataUnit unit) throws Exception;

    /**
     * Builds the writer for a sub-target on its first use.
     */
    protected abstract TargetWriter createTargetWriter(String targetId, TargetConfiguration target) throws Exception;

    /**
     * Hook run by {@link #close()} after the worker stopped and before the sub-target writers close.
     */
    protected void onClose() {
        // nothing by default
    }

    /**
     * Starts the worker thread. Idempotent; {@link #writeTargetData(DataUnit)} calls it as well.
     */
    public void start() {
        if (closed.get() || !started.compareAndSet(false, true)) return;

        final Thread t = new Thread(this::runWorker, writerId + "-worker");
        t.setDaemon(true);
        this.worker = t;
        t.start();
        log.info("[{}] Forwarding worker started (channel size={})", writerId, channel.capacity());
    }

    /**
     * Enqueues the unit. Blocks while the forward channel is full, and drops the unit if it stays
     * full past the configured timeout.
     *
     * @throws com.intuitivedesigns.edgeforward.channel.ChannelClosedException after {@link #close()}
     */
    @Override
    public void writeTargetData(DataUnit unit) {
        Objects.requireNonNull(unit, "unit");
        start();

        final SubmitResult result = channel.submit(unit);
        if (result == SubmitResult.DROPPED) {
            log.error("[{}] Unit serial={} schedule='{}' dropped, forward channel full", writerId, unit.serial(), unit.scheduleName());
        } else if (result == SubmitResult.CANCELLED) {
            log.debug("[{}] Submit of serial={} cancelled", writerId, unit.serial());
        }
    }

    @Override
    public boolean isInitialized() {
        return !closed.get();
    }

    private void runWorker() {
        while (true) {
            final DataUnit unit = channel.receive();
            if (unit == null) break;

            try {
                forwardTargetData(unit);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) break;
                log.error("[{}] Forwarding unit serial={} failed", writerId, unit.serial(), e);
            }
        }
        log.debug("[{}] Forwarding worker stopped", writerId);
    }

    /**
     * Stops the worker, then closes the sub-target writers and the metrics processor.
     * Units still waiting in the channel are discarded.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        log.info("[{}] Closing forwarding writer...", writerId);
        channel.close();

        final Thread t = worker;
        if (t != null) {
            t.interrupt();
            try {
                t.join(WORKER_JOIN_TIMEOUT_MS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("[{}] Forwarding worker did not stop within {} ms", writerId, WORKER_JOIN_TIMEOUT_MS);
            }
        }

        final int discarded = channel.size();
        if (discarded > 0) {
            log.warn("[{}] {} queued unit(s) discarded on close", writerId, discarded);
        }

        safeRun(this::onClose, "onClose");
        safeRun(registry::closeAll, "sub-target writers");
        safeRun(metricsProcessor::close, "metrics processor");
        log.info("[{}] Forwarding writer closed. dropped={}", writerId, channel.dropped());
    }

    /**
     * Creates a sub-target writer through the factory registered for its type.
     *
     * @param resultHandler receives the writer's asynchronous results; null for none
     */
    protected TargetWriter newWriter(String targetId, TargetConfiguration target, TargetResultHandler resultHandler) {
        final WriterFactory factory = writerFactories.require(target.type(),
                TargetConfiguration.key(targetId, TargetConfiguration.KEY_TYPE));
        try {
            final TargetWriter w = factory.create(new WriterContext(targetId, target, config, metrics, resultHandler));
            if (w == null) {
                throw new TargetException(targetId, "Writer factory " + factory.id() + " returned no writer for '" + targetId + "'");
            }
            return w;
        } catch (TargetException e) {
            throw e;
        } catch (Exception e) {
            throw new TargetException(targetId, "Failed to create " + factory.id() + " writer for '" + targetId + "': " + e.getMessage(), e);
        }
    }

    public String writerId() {
        return writerId;
    }

    public SubTargetRegistry registry() {
        return registry;
    }

    public BoundedDeliveryChannel<DataUnit> channel() {
        return channel;
    }

    private void safeRun(Runnable r, String what) {
        try {
            r.run();
        } catch (Exception e) {
            log.warn("[{}] Error closing {}", writerId, what, e);
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.channel.ChannelClosedException;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.NamedDaemonThreadFactory;
import com.intuitivedesigns.edgeforward.core.ReturnedData;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetResultHandler;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import com.intuitivedesigns.edgeforward.targets.ForwardingTargetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers every unit to all primary targets of its routing table.
 *
 * <p>Routes run concurrently. A route succeeds when its primary accepts the unit within
 * {@link #TIMEOUT_TARGET_FORWARD}, or, failing that, its alternate does. The route results are
 * combined by the {@link AggregationPolicy} and reported upstream as a single ack or error.</p>
 *
 * <p>Primary writers report their asynchronous results back to this router, which hands them to
 * the {@link ResultReconciler} for success and alternate routing.</p>
 */
public class RouterTargetWriter extends ForwardingTargetWriter implements TargetResultHandler {

    private static final Logger log = LoggerFactory.getLogger(RouterTargetWriter.class);

    public static final Duration TIMEOUT_TARGET_FORWARD = Duration.ofSeconds(10);

    public static final String METRIC_WRITES = "edgeforward.target.writes";
    public static final String METRIC_MESSAGES = "edgeforward.target.messages";
    public static final String METRIC_WRITE_SUCCESS = "edgeforward.target.write.success";
    public static final String METRIC_WRITE_ERRORS = "edgeforward.target.write.errors";

    private final RoutingTable routingTable;
    private final Duration forwardTimeout;
    private final TargetResultHelper upstream;
    private final ReturnedData returnedData;
    private final ExecutorService executor;
    private final ResultReconciler reconciler;

    public RouterTargetWriter(String routerId,
                              ForwarderConfig config,
                              ServicePluginRegistry<WriterFactory> writerFactories,
                              MetricsRuntime metrics,
                              TargetResultHandler upstreamHandler) {
        this(routerId, config, RoutingTable.fromConfig(config, routerId), writerFactories, metrics,
                upstreamHandler, TIMEOUT_TARGET_FORWARD);
    }

    public RouterTargetWriter(String routerId,
                              ForwarderConfig config,
                              RoutingTable routingTable,
                              ServicePluginRegistry<WriterFactory> writerFactories,
                              MetricsRuntime metrics,
                              TargetResultHandler upstreamHandler,
                              Duration forwardTimeout) {
        super(routerId, config, Objects.requireNonNull(routingTable, "routingTable").subTargetIds(), writerFactories, metrics);
        this.routingTable = routingTable;
        this.forwardTimeout = Objects.requireNonNull(forwardTimeout, "forwardTimeout");
        this.upstream = new TargetResultHelper(routerId, upstreamHandler);
        this.returnedData = new ReturnedData(
                routingTable.hasSuccessRoutes() ? ReturnedData.Content.MESSAGES : ReturnedData.Content.NONE,
                routingTable.hasAlternateRoutes() ? ReturnedData.Content.MESSAGES : ReturnedData.Content.NONE,
                routingTable.hasAlternateRoutes() ? ReturnedData.Content.MESSAGES : ReturnedData.Content.NONE);

        this.executor = Executors.newCachedThreadPool(new NamedDaemonThreadFactory(routerId + "-forward"));
        this.reconciler = new ResultReconciler(routerId, routingTable, this::forwardToTarget, executor,
                Math.max(1, config.getInt(ResultReconciler.CONFIG_CHANNEL_SIZE, ResultReconciler.DEFAULT_CHANNEL_SIZE)),
                Duration.ofMillis(Math.max(0L, config.getLong(ResultReconciler.CONFIG_CHANNEL_TIMEOUT,
                        ResultReconciler.DEFAULT_CHANNEL_TIMEOUT_MS))));

        log.info("[{}] Router created: policy={} routes={}", routerId, routingTable.policy(), routingTable.routes());
    }

    @Override
    public void start() {
        if (!isInitialized()) return;
        reconciler.start();
        super.start();
    }

    @Override
    protected void forwardTargetData(DataUnit unit) throws InterruptedException {
        final List<Route> routes = routingTable.routes();
        final List<CompletableFuture<Boolean>> pending = new ArrayList<>(routes.size());
        for (Route route : routes) {
            pending.add(CompletableFuture.supplyAsync(() -> forwardRoute(route, unit), executor));
        }

        final List<Boolean> results = new ArrayList<>(pending.size());
        for (CompletableFuture<Boolean> f : pending) {
            try {
                results.add(f.get());
            } catch (ExecutionException e) {
                log.error("[{}] Route for serial={} failed", writerId, unit.serial(), e.getCause());
                results.add(Boolean.FALSE);
            }
        }

        final boolean delivered = routingTable.policy().combine(results);
        if (delivered) {
            upstream.ack(unit);
        } else {
            log.warn("[{}] Unit serial={} not delivered (policy={}, routes={})",
                    writerId, unit.serial(), routingTable.policy(), results);
            upstream.error(unit);
        }
    }

    private boolean forwardRoute(Route route, DataUnit unit) {
        if (forwardToTarget(route.primary(), unit, RouteType.PRIMARY)) return true;
        if (!route.hasAlternate()) return false;
        return forwardToTarget(route.alternate(), unit, RouteType.ALTERNATE);
    }

    /**
     * Single attempt bounded by the forward timeout. Timeouts and writer exceptions count as failure.
     */
    boolean forwardToTarget(String targetId, DataUnit unit, RouteType routeType) {
        final TargetWriter writer = registry.getOrCreate(targetId);
        if (writer == null) {
            recordAttempt(targetId, false);
            return false;
        }
        if (!writer.isInitialized()) {
            log.warn("[{}] {} target '{}' is not initialized, serial={} fails", writerId, routeType, targetId, unit.serial());
            recordAttempt(targetId, false);
            return false;
        }

        final Future<?> attempt;
        try {
            attempt = executor.submit(() -> {
                writer.writeTargetData(unit);
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Forward of serial={} to '{}' rejected, router closing", writerId, unit.serial(), targetId);
            return false;
        }

        boolean ok = false;
        try {
            attempt.get(forwardTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ok = true;
        } catch (TimeoutException e) {
            attempt.cancel(true);
            log.warn("[{}] Timeout after {} ms forwarding serial={} to {} target '{}'",
                    writerId, forwardTimeout.toMillis(), unit.serial(), routeType, targetId);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[{}] Error forwarding serial={} to {} target '{}': {}",
                    writerId, unit.serial(), routeType, targetId, cause.toString());
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
        }

        recordAttempt(targetId, ok);
        return ok;
    }

    private void recordAttempt(String targetId, boolean ok) {
        final Map<String, String> tags = Map.of("target", targetId, "router", writerId);
        metrics.counter(METRIC_WRITES, 1, tags);
        metrics.counter(METRIC_MESSAGES, 1, tags);
        metrics.counter(ok ? METRIC_WRITE_SUCCESS : METRIC_WRITE_ERRORS, 1, tags);
    }

    @Override
    protected TargetWriter createTargetWriter(String targetId, TargetConfiguration target) {
        // only primaries report back; success and alternate outcomes are observed synchronously
        final TargetResultHandler handler = routingTable.isPrimary(targetId) ? this : null;
        return newWriter(targetId, target, handler);
    }

    @Override
    public void handleResult(TargetResult result) {
        try {
            reconciler.submit(result);
        } catch (ChannelClosedException e) {
            log.debug("[{}] Router closed, result of '{}' with {} unit(s) ignored", writerId, result.targetId(), result.size());
        }
    }

    @Override
    public ReturnedData returnedData() {
        return returnedData;
    }

    public RoutingTable routingTable() {
        return routingTable;
    }

    @Override
    protected void onClose() {
        reconciler.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(forwardTimeout.toMillis() + 1_000L, TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Forward attempts still running after close, interrupting", writerId);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.channel.BoundedDeliveryChannel;
import com.intuitivedesigns.edgeforward.channel.SubmitResult;
import com.intuitivedesigns.edgeforward.channel.TuningChannelEventHandler;
import com.intuitivedesigns.edgeforward.core.SerialUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Second-wave routing driven by the asynchronous results of primary targets.
 *
 * <p>Acked units go to the route's success target, nacked and errored units to its alternate
 * target. Each unit is forwarded once; the outcome of that forward is only logged, the unit's
 * result was already reported upstream by the router.</p>
 */
public final class ResultReconciler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    public static final String CONFIG_CHANNEL_SIZE = "tuning.result.channel.size";
    public static final String CONFIG_CHANNEL_TIMEOUT = "tuning.result.channel.timeout.ms";
    public static final int DEFAULT_CHANNEL_SIZE = 100;
    public static final long DEFAULT_CHANNEL_TIMEOUT_MS = 10_000L;

    private final String ownerId;
    private final RoutingTable routingTable;
    private final TargetForwarder forwarder;
    private final ExecutorService executor;
    private final BoundedDeliveryChannel<TargetResult> channel;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread worker;

    public ResultReconciler(String ownerId,
                            RoutingTable routingTable,
                            TargetForwarder forwarder,
                            ExecutorService executor,
                            int channelSize,
                            Duration channelTimeout) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.channel = new BoundedDeliveryChannel<>(ownerId + "-results", channelSize, channelTimeout,
                new TuningChannelEventHandler(CONFIG_CHANNEL_SIZE, CONFIG_CHANNEL_TIMEOUT, log));
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;

        final Thread t = new Thread(this::runWorker, ownerId + "-results");
        t.setDaemon(true);
        this.worker = t;
        t.start();
    }

    /**
     * Queues a result for reconciliation.
     *
     * @throws com.intuitivedesigns.edgeforward.channel.ChannelClosedException after {@link #close()}
     */
    public SubmitResult submit(TargetResult result) {
        Objects.requireNonNull(result, "result");
        final SubmitResult r = channel.submit(result);
        if (r == SubmitResult.DROPPED) {
            log.error("[{}] Result of target '{}' with {} unit(s) dropped, result channel full",
                    ownerId, result.targetId(), result.size());
        } else if (r == SubmitResult.CANCELLED) {
            log.warn("[{}] Result of target '{}' with {} unit(s) discarded, reporting thread interrupted",
                    ownerId, result.targetId(), result.size());
        }
        return r;
    }

    private void runWorker() {
        while (true) {
            final TargetResult result = channel.receive();
            if (result == null) break;

            try {
                reconcile(result);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("[{}] Reconciling result of target '{}' failed", ownerId, result.targetId(), e);
            }
        }
        log.debug("[{}] Result worker stopped", ownerId);
    }

    /**
     * Forwards the units of one result to the route's success and alternate targets.
     * Both paths run concurrently, each one unit after the other.
     */
    public void reconcile(TargetResult result) throws InterruptedException {
        final Route route = routingTable.route(result.targetId());
        if (route == null) {
            log.debug("[{}] Ignoring result from '{}', not a primary target", ownerId, result.targetId());
            return;
        }

        final List<CompletableFuture<Void>> paths = new ArrayList<>(2);

        if (route.hasSuccess() && !result.acked().isEmpty()) {
            paths.add(CompletableFuture.runAsync(
                    () -> forwardAll(route, route.success(), result.acked(), RouteType.SUCCESS), executor));
        }

        if (route.hasAlternate() && (!result.nacked().isEmpty() || !result.errored().isEmpty())) {
            final List<SerialUnit> failed = new ArrayList<>(result.nacked().size() + result.errored().size());
            failed.addAll(result.nacked());
            failed.addAll(result.errored());
            paths.add(CompletableFuture.runAsync(
                    () -> forwardAll(route, route.alternate(), failed, RouteType.ALTERNATE), executor));
        }

        if (paths.isEmpty()) return;

        try {
            CompletableFuture.allOf(paths.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            log.error("[{}] Second-wave forwarding for '{}' failed", ownerId, route.primary(), e.getCause());
        }
    }

    private void forwardAll(Route route, String targetId, List<SerialUnit> units, RouteType type) {
        for (SerialUnit su : units) {
            if (Thread.currentThread().isInterrupted()) return;

            if (!su.hasUnit()) {
                log.warn("[{}] Result from '{}' for serial {} carries no unit, cannot forward to {} target '{}'",
                        ownerId, route.primary(), su.serial(), type, targetId);
                continue;
            }

            if (!forwarder.forward(targetId, su.unit(), type)) {
                log.warn("[{}] Forwarding serial {} to {} target '{}' of '{}' failed",
                        ownerId, su.serial(), type, targetId, route.primary());
            }
        }
    }

    public int pending() {
        return channel.size();
    }

    @Override
    public void close() {
        channel.close();
        final Thread t = worker;
        if (t != null) {
            t.interrupt();
            try {
                t.join(5_000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        final int discarded = channel.size();
        if (discarded > 0) {
            log.warn("[{}] {} pending result(s) discarded on close", ownerId, discarded);
        }
    }
}

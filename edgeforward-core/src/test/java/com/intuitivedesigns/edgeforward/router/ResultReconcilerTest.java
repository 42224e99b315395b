/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.intuitivedesigns.edgeforward.channel.ChannelClosedException;
import com.intuitivedesigns.edgeforward.channel.SubmitResult;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.SerialUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.intuitivedesigns.edgeforward.targets.StubWriterFactory.awaitUntil;
import static org.junit.jupiter.api.Assertions.*;

class ResultReconcilerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<String> forwarded = new CopyOnWriteArrayList<>();

    private final RoutingTable table = RoutingTable.builder("router")
            .route("A", "S", "F")
            .route("B")
            .build();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static DataUnit unit(long serial) {
        return new DataUnit(serial, "schedule", "p", Map.of(), null, false);
    }

    private ResultReconciler reconciler(TargetForwarder forwarder) {
        return new ResultReconciler("router", table, forwarder, executor, 10, Duration.ofMillis(100));
    }

    @Test
    void reconcile_routesEachOutcomeToItsTarget() throws Exception {
        ResultReconciler r = reconciler((target, u, type) -> forwarded.add(target + ":" + u.serial() + ":" + type));

        r.reconcile(new TargetResult("A",
                List.of(SerialUnit.of(unit(1)), SerialUnit.of(unit(2))),
                List.of(SerialUnit.of(unit(3))),
                List.of(SerialUnit.of(unit(4)))));

        assertEquals(4, forwarded.size());
        assertTrue(forwarded.containsAll(List.of("S:1:SUCCESS", "S:2:SUCCESS", "F:3:ALTERNATE", "F:4:ALTERNATE")));
        // each path is sequential
        assertTrue(forwarded.indexOf("S:1:SUCCESS") < forwarded.indexOf("S:2:SUCCESS"));
        assertTrue(forwarded.indexOf("F:3:ALTERNATE") < forwarded.indexOf("F:4:ALTERNATE"));
    }

    @Test
    void reconcile_successAndFailurePathsRunConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        ResultReconciler r = reconciler((target, u, type) -> {
            bothStarted.countDown();
            try {
                return bothStarted.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        r.reconcile(new TargetResult("A", List.of(SerialUnit.of(unit(1))), List.of(), List.of(SerialUnit.of(unit(2)))));

        assertEquals(0, bothStarted.getCount());
    }

    @Test
    void reconcile_skipsSerialOnlyPairsAndRoutesWithoutSecondaries() throws Exception {
        ResultReconciler r = reconciler((target, u, type) -> forwarded.add(target));

        r.reconcile(TargetResult.ack("A", List.of(SerialUnit.serialOnly(unit(1)))));
        r.reconcile(TargetResult.error("B", List.of(SerialUnit.of(unit(2)))));
        r.reconcile(TargetResult.ack("S", List.of(SerialUnit.of(unit(3)))));

        assertTrue(forwarded.isEmpty());
    }

    @Test
    void reconcile_failedSecondForwardIsTerminal() throws Exception {
        ResultReconciler r = reconciler((target, u, type) -> {
            forwarded.add(target);
            return false;
        });

        r.reconcile(TargetResult.nack("A", List.of(SerialUnit.of(unit(1)))));

        assertEquals(List.of("F"), forwarded);
    }

    @Test
    void submit_isProcessedByWorkerUntilClosed() throws Exception {
        ResultReconciler r = reconciler((target, u, type) -> forwarded.add(target + ":" + u.serial()));
        r.start();

        r.submit(TargetResult.ack("A", List.of(SerialUnit.of(unit(5)))));

        awaitUntil(() -> forwarded.size() == 1, 5_000);
        assertEquals(List.of("S:5"), forwarded);

        r.close();
        assertThrows(ChannelClosedException.class,
                () -> r.submit(TargetResult.ack("A", List.of(SerialUnit.of(unit(6))))));
    }

    @Test
    void submit_fromInterruptedThreadShouldWarnAndReportCancelled() {
        ResultReconciler r = new ResultReconciler("router", table, (t, u, type) -> true, executor, 1, Duration.ofSeconds(5));
        Logger logger = (Logger) LoggerFactory.getLogger(ResultReconciler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertEquals(SubmitResult.SUBMITTED, r.submit(TargetResult.ack("A", List.of(SerialUnit.of(unit(1))))));

            Thread.currentThread().interrupt();
            SubmitResult second = r.submit(TargetResult.ack("A", List.of(SerialUnit.of(unit(2)))));

            assertTrue(Thread.interrupted());
            assertEquals(SubmitResult.CANCELLED, second);
            assertEquals(1, r.pending());
            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                    && e.getFormattedMessage().contains("interrupted")));
        } finally {
            logger.detachAppender(appender);
            r.close();
        }
    }
}

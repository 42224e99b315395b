/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.targets;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.intuitivedesigns.edgeforward.targets.StubWriterFactory.awaitUntil;
import static org.junit.jupiter.api.Assertions.*;

class ForwardingTargetWriterTest {

    private static final long WAIT_MS = 5_000L;

    private final CapturingAppender appender = new CapturingAppender();
    private final Logger logger = (Logger) LoggerFactory.getLogger(ForwardingTargetWriter.class);

    private RecordingWriter writer;

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        if (writer != null) {
            writer.release.countDown();
            writer.close();
        }
        logger.detachAppender(appender);
        appender.stop();
    }

    private RecordingWriter writer(Map<String, String> config) {
        writer = new RecordingWriter(ForwarderConfig.fromMap(config));
        return writer;
    }

    private static DataUnit unit(long serial) {
        return new DataUnit(serial, "schedule-1", "payload-" + serial, Map.of(), null, false);
    }

    @Test
    void failingUnit_shouldBeLoggedAndNextUnitStillForwarded() throws Exception {
        RecordingWriter w = writer(Map.of());
        w.failFirst = true;
        w.release.countDown();

        w.writeTargetData(unit(1));
        w.writeTargetData(unit(2));

        awaitUntil(() -> w.forwarded.size() == 2, WAIT_MS);
        assertEquals(List.of(1L, 2L), List.of(w.forwarded.get(0).serial(), w.forwarded.get(1).serial()));
        assertTrue(appender.errors().stream().anyMatch(e -> e.getFormattedMessage().contains("serial=1")));
        assertTrue(appender.errors().stream().noneMatch(e -> e.getFormattedMessage().contains("serial=2")));
    }

    @Test
    void close_shouldStopBusyWorkerWithoutErrorLogs() throws Exception {
        RecordingWriter w = writer(Map.of());

        w.writeTargetData(unit(1));
        assertTrue(w.entered.await(WAIT_MS, TimeUnit.MILLISECONDS));

        w.close();

        assertFalse(w.isInitialized());
        assertTrue(w.interrupted);
        assertFalse(workerAlive("fwd-worker"));
        assertTrue(appender.errors().isEmpty());
    }

    @Test
    void fullChannel_shouldDropUnitAndLogErrorWithoutThrowing() throws Exception {
        RecordingWriter w = writer(Map.of(
                ForwardingTargetWriter.CONFIG_CHANNEL_SIZE, "1",
                ForwardingTargetWriter.CONFIG_CHANNEL_TIMEOUT, "50"));

        w.writeTargetData(unit(1));
        assertTrue(w.entered.await(WAIT_MS, TimeUnit.MILLISECONDS));
        w.writeTargetData(unit(2));

        assertDoesNotThrow(() -> w.writeTargetData(unit(3)));

        assertEquals(1, w.channel().dropped());
        assertEquals(1, w.channel().size());
        assertTrue(appender.errors().stream().anyMatch(e -> e.getFormattedMessage().contains("serial=3")));

        w.release.countDown();
        awaitUntil(() -> w.forwarded.size() == 2, WAIT_MS);
        assertEquals(2L, w.forwarded.get(1).serial());
    }

    private static boolean workerAlive(String name) {
        return Thread.getAllStackTraces().keySet().stream()
                .anyMatch(t -> t.getName().equals(name) && t.isAlive());
    }

    private static final class RecordingWriter extends ForwardingTargetWriter {
        final List<DataUnit> forwarded = new CopyOnWriteArrayList<>();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean failFirst;
        volatile boolean interrupted;

        RecordingWriter(ForwarderConfig config) {
            super("fwd", config, List.of(), ServicePluginRegistry.of(WriterFactory.class, List.of()), () -> null);
        }

        @Override
        protected void forwardTargetData(DataUnit unit) throws Exception {
            forwarded.add(unit);
            entered.countDown();
            if (failFirst && forwarded.size() == 1) {
                throw new IllegalStateException("bad unit");
            }
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted = true;
                throw e;
            }
        }

        @Override
        protected TargetWriter createTargetWriter(String targetId, TargetConfiguration target) {
            throw new UnsupportedOperationException("no sub-targets");
        }
    }

    private static final class CapturingAppender extends AppenderBase<ILoggingEvent> {
        private final List<ILoggingEvent> events = new CopyOnWriteArrayList<>();

        @Override
        protected void append(ILoggingEvent event) {
            events.add(event);
        }

        List<ILoggingEvent> errors() {
            return events.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
        }
    }
}

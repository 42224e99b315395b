/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.app;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.SerialUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticScheduleSourceTest {

    private final List<DataUnit> written = new CopyOnWriteArrayList<>();
    private final TargetWriter writer = written::add;

    @Test
    void fromConfig_shouldBeOffByDefault() {
        assertNull(SyntheticScheduleSource.fromConfig(ForwarderConfig.fromMap(Map.of()), writer));
    }

    @Test
    void emit_shouldWriteUnitForConfiguredSchedule() throws Exception {
        ForwarderConfig config = ForwarderConfig.fromMap(Map.of(
                SyntheticScheduleSource.CFG_ENABLED, "true",
                SyntheticScheduleSource.CFG_SCHEDULE, "line-3"));

        SyntheticScheduleSource source = SyntheticScheduleSource.fromConfig(config, writer);
        assertNotNull(source);

        source.emit();
        source.emit();

        assertEquals(2, written.size());
        assertEquals("line-3", written.get(0).scheduleName());
        assertEquals("synthetic", written.get(0).metadata().get("source"));
        assertTrue(written.get(1).serial() > written.get(0).serial());
        assertEquals(2, source.emittedTotal());
    }

    @Test
    void start_shouldEmitUntilClosed() throws Exception {
        SyntheticScheduleSource source = new SyntheticScheduleSource("fast", 5L, writer);
        source.start();

        long deadline = System.currentTimeMillis() + 2_000L;
        while (written.size() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5L);
        }
        source.close();

        assertTrue(written.size() >= 3);
        int afterClose = written.size();
        Thread.sleep(50L);
        assertEquals(afterClose, written.size());
    }

    @Test
    void loggingResultHandler_shouldCountOutcomes() {
        LoggingResultHandler handler = new LoggingResultHandler();
        SerialUnit one = new SerialUnit(1L, null);
        SerialUnit two = new SerialUnit(2L, null);

        handler.handleResult(TargetResult.ack("router", List.of(one)));
        handler.handleResult(new TargetResult("router", List.of(), List.of(one), List.of(two)));

        assertEquals(1, handler.ackedTotal());
        assertEquals(2, handler.failedTotal());
    }
}

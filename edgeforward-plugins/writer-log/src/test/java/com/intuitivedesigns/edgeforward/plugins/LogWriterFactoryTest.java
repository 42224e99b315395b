/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.plugins;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.MetricsDataPoint;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogWriterFactoryTest {

    private final ForwarderConfig config = ForwarderConfig.fromMap(Map.of(
            "target.log.type", "LOG",
            "target.log.log.level", "debug",
            "target.log.log.max.chars", "4",
            "target.sink.type", "DEVNULL"));

    private final MetricsRuntime metrics = () -> null;
    private final List<TargetResult> results = new ArrayList<>();

    private WriterContext context(String id) {
        TargetConfiguration target = TargetConfiguration.find(config, id).orElseThrow();
        return new WriterContext(id, target, config, metrics, results::add);
    }

    @Test
    void serviceLoader_shouldDiscoverBothWriters() {
        ServicePluginRegistry<WriterFactory> registry = new ServicePluginRegistry<>(WriterFactory.class);

        assertTrue(registry.get("log").isPresent());
        assertTrue(registry.get("devnull").isPresent());
    }

    @Test
    void logWriter_shouldAckEveryUnitAndCountIt() throws Exception {
        TargetWriter writer = new LogWriterFactory().create(context("log"));
        DataUnit unit = DataUnit.create("schedule", "a long payload", false);

        writer.writeTargetData(unit);

        assertEquals(1, results.size());
        assertEquals(unit.serial(), results.get(0).acked().get(0).serial());
        assertSame(unit, results.get(0).acked().get(0).unit());

        List<MetricsDataPoint> points = writer.metricsProvider().collect();
        assertEquals(1.0, points.get(0).value());
        assertEquals(0.0, writer.metricsProvider().collect().get(0).value());
    }

    @Test
    void logWriter_closedShouldRejectUnits() throws Exception {
        TargetWriter writer = new LogWriterFactory().create(context("log"));
        writer.close();

        assertFalse(writer.isInitialized());
        assertThrows(IllegalStateException.class, () -> writer.writeTargetData(DataUnit.create("s", "p", false)));
    }

    @Test
    void devNullWriter_shouldAckAndDiscard() throws Exception {
        TargetWriter writer = new DevNullWriterFactory().create(context("sink"));

        writer.writeTargetData(DataUnit.create("s", "p", false));

        assertEquals(1, results.size());
        assertNull(writer.metricsProvider());
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.output;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.SerialUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.metrics.MetricsDataPoint;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class KafkaTargetWriterTest {

    private final MockProducer<String, String> producer =
            new MockProducer<>(false, new StringSerializer(), new StringSerializer());
    private final List<TargetResult> results = new CopyOnWriteArrayList<>();

    private KafkaTargetWriter writer(int maxInFlight) {
        return new KafkaTargetWriter("kafka-out", "plant-data", producer,
                new TargetResultHelper("kafka-out", results::add), maxInFlight, 1_000L);
    }

    private static DataUnit unit(long serial) {
        return new DataUnit(serial, "line-1", "{\"temp\":21.5}", Map.of("site", "p7"), null, false);
    }

    @Test
    void send_shouldKeyBySerialAndCarryHeaders() throws Exception {
        KafkaTargetWriter w = writer(10);

        w.writeTargetData(unit(5));

        ProducerRecord<String, String> record = producer.history().get(0);
        assertEquals("plant-data", record.topic());
        assertEquals("5", record.key());
        assertEquals("{\"temp\":21.5}", record.value());
        assertEquals("line-1", new String(record.headers().lastHeader(KafkaTargetWriter.HEADER_SCHEDULE).value(), StandardCharsets.UTF_8));
        assertEquals("p7", new String(record.headers().lastHeader("site").value(), StandardCharsets.UTF_8));
    }

    @Test
    void brokerAck_shouldReportAckAfterTheWriteReturned() throws Exception {
        KafkaTargetWriter w = writer(10);
        DataUnit u = unit(5);

        w.writeTargetData(u);
        assertTrue(results.isEmpty());
        assertEquals(1, w.inFlightTotal());

        assertTrue(producer.completeNext());

        assertEquals(1, results.size());
        SerialUnit acked = results.get(0).acked().get(0);
        assertEquals(5L, acked.serial());
        assertSame(u, acked.unit());
        assertEquals(0, w.inFlightTotal());
    }

    @Test
    void noBufferingUnit_shouldBeFlushedImmediately() throws Exception {
        KafkaTargetWriter w = writer(10);
        DataUnit urgent = new DataUnit(8, "alarms", "{\"trip\":true}", Map.of(), null, true);

        w.writeTargetData(unit(7));
        assertTrue(results.isEmpty());

        w.writeTargetData(urgent);

        assertEquals(2, results.size());
        assertEquals(8L, results.get(1).acked().get(0).serial());
        assertEquals(0, w.inFlightTotal());
        assertFalse(producer.completeNext());
    }

    @Test
    void brokerError_shouldReportError() throws Exception {
        KafkaTargetWriter w = writer(10);

        w.writeTargetData(unit(6));
        assertTrue(producer.errorNext(new RuntimeException("leader not available")));

        assertEquals(1, results.size());
        assertEquals(6L, results.get(0).errored().get(0).serial());
        assertTrue(results.get(0).acked().isEmpty());

        List<MetricsDataPoint> points = w.metricsProvider().collect();
        assertEquals(0.0, points.get(0).value());
        assertEquals(1.0, points.get(1).value());
    }

    @Test
    void closedWriter_shouldRejectUnits() throws Exception {
        KafkaTargetWriter w = writer(0);
        w.close();

        assertFalse(w.isInitialized());
        assertTrue(producer.closed());
        assertThrows(IllegalStateException.class, () -> w.writeTargetData(unit(7)));
    }

    @Test
    void factory_shouldRequireTopic() {
        ForwarderConfig config = ForwarderConfig.fromMap(Map.of("target.k.type", "KAFKA"));
        TargetConfiguration target = TargetConfiguration.find(config, "k").orElseThrow();
        MetricsRuntime metrics = () -> null;

        assertThrows(ConfigurationException.class,
                () -> new KafkaWriterFactory().create(new WriterContext("k", target, config, metrics, null)));
    }

    @Test
    void producerProperties_shouldMapTargetKeys() {
        ForwarderConfig config = ForwarderConfig.fromMap(Map.of(
                "target.k.type", "KAFKA",
                "target.k.kafka.bootstrap.servers", "broker:9093",
                "target.k.kafka.producer.acks", "1",
                "target.k.kafka.security.protocol", "SSL",
                "target.k.kafka.ssl.truststore.location", "/etc/ts.jks"));

        Properties props = KafkaWriterFactory.producerProperties(TargetConfiguration.find(config, "k").orElseThrow());

        assertEquals("broker:9093", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("1", props.get(ProducerConfig.ACKS_CONFIG));
        assertEquals("edgeforward-k", props.get(ProducerConfig.CLIENT_ID_CONFIG));
        assertEquals("SSL", props.get("security.protocol"));
        assertEquals("/etc/ts.jks", props.get("ssl.truststore.location"));
    }
}

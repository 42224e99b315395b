/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.output;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Kafka target. Keys below {@code target.<id>.}:
 *
 * <pre>
 * kafka.topic=plant-data                  (required)
 * kafka.bootstrap.servers=localhost:9092
 * kafka.producer.acks=all
 * kafka.producer.compression=lz4
 * kafka.producer.linger.ms=5
 * kafka.producer.batch.size=65536
 * kafka.inflight.max=10000                (0 disables the in-flight limit)
 * kafka.error.log.interval.ms=1000
 * kafka.ssl.* / kafka.sasl.* / kafka.security.*   passed through without the "kafka." prefix
 * </pre>
 * <p>
 * ID: KAFKA
 */
public final class KafkaWriterFactory implements WriterFactory {

    public static final String ID = "KAFKA";

    static final String CFG_TOPIC = "kafka.topic";
    static final String CFG_INFLIGHT_MAX = "kafka.inflight.max";
    static final String CFG_ERROR_LOG_INTERVAL_MS = "kafka.error.log.interval.ms";

    private static final int DEFAULT_INFLIGHT_MAX = 10_000;
    private static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 1_000L;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TargetWriter create(WriterContext context) {
        Objects.requireNonNull(context, "context");
        final TargetConfiguration target = context.target();

        final String topic = target.getString(CFG_TOPIC, null);
        if (topic == null) {
            throw new ConfigurationException("Kafka target '" + context.targetId() + "' needs a topic",
                    TargetConfiguration.key(context.targetId(), CFG_TOPIC));
        }

        final KafkaProducer<String, String> producer = new KafkaProducer<>(producerProperties(target));

        return new KafkaTargetWriter(
                context.targetId(),
                topic,
                producer,
                new TargetResultHelper(context.targetId(), context.resultHandler()),
                Math.max(0, target.getInt(CFG_INFLIGHT_MAX, DEFAULT_INFLIGHT_MAX)),
                Math.max(100L, target.getLong(CFG_ERROR_LOG_INTERVAL_MS, DEFAULT_ERROR_LOG_INTERVAL_MS)));
    }

    static Properties producerProperties(TargetConfiguration target) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, target.getString("kafka.bootstrap.servers", "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, target.getString("kafka.producer.client.id", "edgeforward-" + target.id()));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Durability
        props.put(ProducerConfig.ACKS_CONFIG, target.getString("kafka.producer.acks", "all"));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Integer.toString(target.getInt("kafka.producer.delivery.timeout.ms", 120_000)));

        // Performance
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, target.getString("kafka.producer.compression", "lz4"));
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, Integer.toString(target.getInt("kafka.producer.batch.size", 65_536)));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(target.getInt("kafka.producer.linger.ms", 5)));

        // Security passthrough: kafka.ssl.*, kafka.security.*, kafka.sasl.* -> strip "kafka."
        for (Map.Entry<String, String> e : target.properties().entrySet()) {
            final String key = e.getKey();
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                if (e.getValue() != null) props.put(key.substring(6), e.getValue());
            }
        }
        return props;
    }
}

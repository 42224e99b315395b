/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.config;

import com.intuitivedesigns.edgeforward.spi.PluginIds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Configuration of one target, read from the {@code target.<id>.*} keys.
 *
 * <pre>
 * target.kafka-out.type=KAFKA
 * target.kafka-out.active=true
 * target.kafka-out.metrics.enabled=true
 * target.kafka-out.kafka.topic=plant-data
 * </pre>
 *
 * @param id             target id
 * @param type           writer type, normalized to upper case
 * @param active         inactive targets are never instantiated
 * @param metricsEnabled whether the writer's metrics are collected
 * @param properties     every {@code target.<id>.*} entry with the prefix stripped
 */
public record TargetConfiguration(
        String id,
        String type,
        boolean active,
        boolean metricsEnabled,
        Map<String, String> properties
) {

    public static final String PREFIX = "target.";
    public static final String KEY_TYPE = "type";
    public static final String KEY_ACTIVE = "active";
    public static final String KEY_METRICS_ENABLED = "metrics.enabled";

    public TargetConfiguration {
        Objects.requireNonNull(id, "id");
        type = PluginIds.normalize(type);
        properties = (properties == null) ? Map.of() : Map.copyOf(properties);
    }

    public static String key(String targetId, String name) {
        return PREFIX + targetId + "." + name;
    }

    /**
     * Every target that declares a {@code type}, in id order.
     */
    public static Map<String, TargetConfiguration> all(ForwarderConfig config) {
        Objects.requireNonNull(config, "config");

        final TreeSet<String> ids = new TreeSet<>();
        final String suffix = "." + KEY_TYPE;
        for (String key : config.keys()) {
            if (key.startsWith(PREFIX) && key.endsWith(suffix) && key.length() > PREFIX.length() + suffix.length()) {
                final String id = key.substring(PREFIX.length(), key.length() - suffix.length());
                // writer specific keys such as target.x.kafka.type are not target declarations
                if (!id.contains(".")) ids.add(id);
            }
        }

        final Map<String, TargetConfiguration> out = new LinkedHashMap<>();
        for (String id : ids) {
            find(config, id).ifPresent(t -> out.put(id, t));
        }
        return Collections.unmodifiableMap(out);
    }

    public static Optional<TargetConfiguration> find(ForwarderConfig config, String targetId) {
        Objects.requireNonNull(config, "config");
        if (targetId == null || targetId.isBlank()) return Optional.empty();

        final String type = config.getString(key(targetId, KEY_TYPE), null);
        if (type == null || type.isBlank()) return Optional.empty();

        return Optional.of(new TargetConfiguration(
                targetId,
                type,
                config.getBoolean(key(targetId, KEY_ACTIVE), true),
                config.getBoolean(key(targetId, KEY_METRICS_ENABLED), false),
                config.subset(PREFIX + targetId + ".")
        ));
    }

    public String getString(String name, String defaultValue) {
        final String v = properties.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public int getInt(String name, int defaultValue) {
        try {
            final String v = properties.get(name);
            return (v == null) ? defaultValue : Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String name, long defaultValue) {
        try {
            final String v = properties.get(name);
            return (v == null) ? defaultValue : Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        final String v = properties.get(name);
        return (v == null) ? defaultValue : Boolean.parseBoolean(v.trim());
    }
}

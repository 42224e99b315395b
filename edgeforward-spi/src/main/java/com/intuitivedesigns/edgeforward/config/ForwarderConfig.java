/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flat properties configuration.
 * Loads from -Def.config.path or ENV 'EF_CONFIG_PATH', or wraps caller supplied properties.
 */
public final class ForwarderConfig {

    private static final Logger log = LoggerFactory.getLogger(ForwarderConfig.class);

    public static final String SYS_PROP_CONFIG_PATH = "ef.config.path";
    public static final String ENV_CONFIG_PATH = "EF_CONFIG_PATH";

    private final Properties props;

    private ForwarderConfig(Properties props) {
        this.props = props;
    }

    public static ForwarderConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new ForwarderConfig(copy);
    }

    public static ForwarderConfig fromMap(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties p = new Properties();
        source.forEach((k, v) -> {
            if (k != null && v != null) p.setProperty(k, v);
        });
        return new ForwarderConfig(p);
    }

    public static ForwarderConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        Properties p = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            p.load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration file " + path + ": " + e.getMessage(), SYS_PROP_CONFIG_PATH, e);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new ForwarderConfig(p);
    }

    /**
     * Resolves the configuration file from the system property first, then the environment.
     */
    public static ForwarderConfig load() {
        String path = System.getProperty(SYS_PROP_CONFIG_PATH);

        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            throw new ConfigurationException(
                    "No configuration file specified. Usage: -D" + SYS_PROP_CONFIG_PATH + "=/path/to/edgeforward.properties",
                    SYS_PROP_CONFIG_PATH);
        }
        return load(Path.of(path.trim()));
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Comma separated list, blanks removed.
     */
    public List<String> getList(String key) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return List.of();

        List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * All entries below {@code prefix}, with the prefix stripped.
     */
    public Map<String, String> subset(String prefix) {
        Map<String, String> out = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.put(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return out;
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(props.stringPropertyNames()));
    }
}

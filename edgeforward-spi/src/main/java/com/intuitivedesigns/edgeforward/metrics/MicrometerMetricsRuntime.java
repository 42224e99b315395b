/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite registry, so a backend such as Prometheus can be attached next to the in-memory one
 * - Stateful "push" gauges keyed by name and tags
 * - Close hooks for resources owned by a backend (e.g. an HTTP scrape endpoint)
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;

    // Micrometer gauges poll; generic gauge calls push into these holders
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();
    private final List<AutoCloseable> closeHooks = new CopyOnWriteArrayList<>();

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
    }

    /**
     * Adds a specific registry (e.g., Prometheus) to the composite.
     */
    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    /**
     * Registers a resource closed together with this runtime.
     */
    public void addCloseHook(AutoCloseable hook) {
        if (hook != null) closeHooks.add(hook);
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name, double increment, Map<String, String> tags) {
        if (increment > 0) {
            registry.counter(name, toTags(tags)).increment(increment);
        }
    }

    @Override
    public void gauge(String name, double value, Map<String, String> tags) {
        final Tags micrometerTags = toTags(tags);
        final String stateKey = name + micrometerTags;

        // computeIfAbsent registers the gauge exactly once per name and tag set
        AtomicDouble state = gaugeState.computeIfAbsent(stateKey, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(name, newState, AtomicDouble::get)
                    .tags(micrometerTags)
                    .register(registry);
            return newState;
        });

        state.set(value);
    }

    @Override
    public void close() {
        for (AutoCloseable hook : closeHooks) {
            try {
                hook.close();
            } catch (Exception e) {
                log.warn("Metrics close hook failed: {}", e.toString());
            }
        }
        registry.close();
        log.info("Metrics Runtime Closed.");
    }

    /**
     * Convert a raw Map into Micrometer {@link Tags}, skipping blank keys and values.
     */
    public static Tags toTags(Map<String, String> input) {
        if (input == null || input.isEmpty()) return Tags.empty();

        final List<Tag> out = new ArrayList<>(input.size());
        for (Map.Entry<String, String> e : input.entrySet()) {
            final String k = safe(e.getKey());
            final String v = safe(e.getValue());
            if (k != null && v != null) {
                out.add(Tag.of(k, v));
            }
        }
        return out.isEmpty() ? Tags.empty() : Tags.of(out);
    }

    private static String safe(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * Mutable double for gauge state.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}

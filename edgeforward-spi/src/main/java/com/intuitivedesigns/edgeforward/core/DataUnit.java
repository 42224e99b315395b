/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One batch of collected values handed to the forwarding engine.
 *
 * Design Principles:
 * - Immutability: referenced, never copied, through the routing pipeline.
 * - Correlation: {@code serial} identifies the unit in every delivery result.
 *
 * @param serial       process-unique, monotonically assigned correlation key.
 * @param scheduleName the schedule that produced the values.
 * @param payload      collected values, opaque to the engine.
 * @param metadata     free-form context (source ids, site tags).
 * @param timestamp    collection time.
 * @param noBuffering  signals that downstream writers must not hold this unit in a batching buffer.
 */
public record DataUnit(
        long serial,
        String scheduleName,
        Object payload,
        Map<String, String> metadata,
        Instant timestamp,
        boolean noBuffering
) {

    private static final AtomicLong SERIALS = new AtomicLong(0L);

    public DataUnit {
        Objects.requireNonNull(scheduleName, "DataUnit scheduleName cannot be null");
        if (timestamp == null) timestamp = Instant.now();
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a unit with the next process-wide serial.
     */
    public static DataUnit create(String scheduleName, Object payload, boolean noBuffering) {
        return create(scheduleName, payload, Map.of(), noBuffering);
    }

    public static DataUnit create(String scheduleName, Object payload, Map<String, String> metadata, boolean noBuffering) {
        return new DataUnit(SERIALS.incrementAndGet(), scheduleName, payload, metadata, Instant.now(), noBuffering);
    }

    public String serialString() {
        return Long.toString(serial);
    }
}

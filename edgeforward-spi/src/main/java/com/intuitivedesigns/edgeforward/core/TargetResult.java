/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import java.util.List;
import java.util.Objects;

/**
 * A batch of delivery outcomes reported by one target.
 *
 * <p>Produced by a writer at its own cadence (per item or batched) and consumed exactly once
 * by the handler it is reported to.</p>
 */
public record TargetResult(
        String targetId,
        List<SerialUnit> acked,
        List<SerialUnit> nacked,
        List<SerialUnit> errored
) {

    public TargetResult {
        Objects.requireNonNull(targetId, "TargetResult targetId cannot be null");
        acked = (acked == null) ? List.of() : List.copyOf(acked);
        nacked = (nacked == null) ? List.of() : List.copyOf(nacked);
        errored = (errored == null) ? List.of() : List.copyOf(errored);
    }

    public static TargetResult ack(String targetId, List<SerialUnit> acked) {
        return new TargetResult(targetId, acked, List.of(), List.of());
    }

    public static TargetResult nack(String targetId, List<SerialUnit> nacked) {
        return new TargetResult(targetId, List.of(), nacked, List.of());
    }

    public static TargetResult error(String targetId, List<SerialUnit> errored) {
        return new TargetResult(targetId, List.of(), List.of(), errored);
    }

    public List<SerialUnit> get(DeliveryOutcome outcome) {
        return switch (outcome) {
            case ACK -> acked;
            case NACK -> nacked;
            case ERROR -> errored;
        };
    }

    public boolean isEmpty() {
        return acked.isEmpty() && nacked.isEmpty() && errored.isEmpty();
    }

    public int size() {
        return acked.size() + nacked.size() + errored.size();
    }
}

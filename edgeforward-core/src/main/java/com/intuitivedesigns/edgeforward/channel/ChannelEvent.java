/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

import java.time.Duration;
import java.util.Objects;

/**
 * Backpressure notification emitted by a {@link BoundedDeliveryChannel}.
 *
 * @param waited time spent waiting for space; zero for {@link Type#SUBMITTED} and {@link Type#BLOCKING}
 */
public record ChannelEvent(Type type, String channelName, int capacity, Duration waited) {

    public enum Type {
        SUBMITTED,
        BLOCKING,
        SUBMITTED_AFTER_BLOCKING,
        TIMEOUT
    }

    public ChannelEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(channelName, "channelName");
        waited = (waited == null) ? Duration.ZERO : waited;
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

/**
 * Receives the backpressure events of a channel. Called on the submitting thread.
 */
@FunctionalInterface
public interface ChannelEventHandler {

    ChannelEventHandler NOOP = event -> { };

    void onEvent(ChannelEvent event);
}

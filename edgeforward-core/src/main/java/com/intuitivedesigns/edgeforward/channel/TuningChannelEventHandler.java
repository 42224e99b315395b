/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

import org.slf4j.Logger;

import java.util.Objects;

/**
 * Logs backpressure events together with the tuning parameters an operator should raise.
 */
public final class TuningChannelEventHandler implements ChannelEventHandler {

    private final String sizeParameter;
    private final String timeoutParameter;
    private final Logger logger;

    public TuningChannelEventHandler(String sizeParameter, String timeoutParameter, Logger logger) {
        this.sizeParameter = Objects.requireNonNull(sizeParameter, "sizeParameter");
        this.timeoutParameter = Objects.requireNonNull(timeoutParameter, "timeoutParameter");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void onEvent(ChannelEvent event) {
        switch (event.type()) {
            case SUBMITTED -> {
                // steady state
            }
            case BLOCKING -> logger.warn(
                    "Channel '{}' is full (capacity {}), submit is blocking. Consider increasing '{}'",
                    event.channelName(), event.capacity(), sizeParameter);
            case SUBMITTED_AFTER_BLOCKING -> logger.warn(
                    "Channel '{}' accepted item after blocking for {} ms. Consider increasing '{}'",
                    event.channelName(), event.waited().toMillis(), sizeParameter);
            case TIMEOUT -> logger.error(
                    "Channel '{}' stayed full for {} ms, item dropped. Increase '{}' or '{}'",
                    event.channelName(), event.waited().toMillis(), sizeParameter, timeoutParameter);
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

public class ChannelClosedException extends IllegalStateException {

    public ChannelClosedException(String channelName) {
        super("Channel '" + channelName + "' is closed");
    }
}

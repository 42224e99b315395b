/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.channel;

/**
 * Outcome of {@link BoundedDeliveryChannel#submit(Object)}.
 */
public enum SubmitResult {
    /** Enqueued without waiting. */
    SUBMITTED,
    /** Enqueued after the channel had been full for a while. */
    SUBMITTED_AFTER_BLOCKING,
    /** The channel stayed full for the whole timeout; the item was discarded. */
    DROPPED,
    /** The submitting thread was interrupted while waiting for space. */
    CANCELLED;

    public boolean accepted() {
        return this == SUBMITTED || this == SUBMITTED_AFTER_BLOCKING;
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

/**
 * Per unit, per target delivery outcome.
 */
public enum DeliveryOutcome {
    /** Delivered. */
    ACK,
    /** Transient failure, e.g. destination unreachable. */
    NACK,
    /** Non-retryable failure. */
    ERROR
}

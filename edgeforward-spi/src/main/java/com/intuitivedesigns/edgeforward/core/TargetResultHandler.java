/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

/**
 * Receives delivery outcomes from a target writer.
 *
 * <p><b>Thread-safety Contract:</b> writers call {@link #handleResult(TargetResult)} from whatever
 * thread completes the delivery (producer I/O threads, timers, forwarding workers).
 * Implementations must be safe to call concurrently and should not block for long.</p>
 */
@FunctionalInterface
public interface TargetResultHandler {

    void handleResult(TargetResult result);

    /**
     * Declares which data the writer should include in reported results.
     */
    default ReturnedData returnedData() {
        return ReturnedData.MESSAGES;
    }
}

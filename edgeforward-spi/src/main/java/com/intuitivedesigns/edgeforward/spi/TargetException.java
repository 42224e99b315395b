/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.edgeforward.spi;

/**
 * A target writer could not be created or used.
 */
public class TargetException extends RuntimeException {

    private final String targetId;

    public TargetException(String targetId, String message) {
        super(message);
        this.targetId = targetId;
    }

    public TargetException(String targetId, String message, Throwable cause) {
        super(message, cause);
        this.targetId = targetId;
    }

    public String targetId() {
        return targetId;
    }
}

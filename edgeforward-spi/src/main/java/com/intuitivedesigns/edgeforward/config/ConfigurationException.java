/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.config;

/**
 * Invalid or incomplete configuration. Raised at startup, never while forwarding.
 */
public class ConfigurationException extends RuntimeException {

    private final String item;

    public ConfigurationException(String message, String item) {
        super(message);
        this.item = item;
    }

    public ConfigurationException(String message, String item, Throwable cause) {
        super(message, cause);
        this.item = item;
    }

    /**
     * @return the configuration key (or key prefix) at fault.
     */
    public String item() {
        return item;
    }

    public static void check(boolean condition, String message, String item) {
        if (!condition) throw new ConfigurationException(message, item);
    }
}

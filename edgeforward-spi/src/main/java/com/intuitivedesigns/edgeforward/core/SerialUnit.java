/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

/**
 * A serial and, when the result handler asked for messages, the unit it belongs to.
 *
 * @param serial the unit serial
 * @param unit   the unit itself, or {@code null} when only serials are returned
 */
public record SerialUnit(long serial, DataUnit unit) {

    public static SerialUnit of(DataUnit unit) {
        return new SerialUnit(unit.serial(), unit);
    }

    public static SerialUnit serialOnly(DataUnit unit) {
        return new SerialUnit(unit.serial(), null);
    }

    public boolean hasUnit() {
        return unit != null;
    }
}

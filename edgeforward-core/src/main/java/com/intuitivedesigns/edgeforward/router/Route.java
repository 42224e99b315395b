/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import java.util.Objects;

/**
 * A primary target with its optional follow-up targets.
 *
 * @param primary   receives every unit
 * @param success   receives units the primary reported as acked; may be null
 * @param alternate receives units the primary failed; may be null
 */
public record Route(String primary, String success, String alternate) {

    public Route {
        Objects.requireNonNull(primary, "primary");
        primary = primary.trim();
        if (primary.isEmpty()) throw new IllegalArgumentException("Route primary target must not be blank");
        success = blankToNull(success);
        alternate = blankToNull(alternate);
    }

    public static Route of(String primary) {
        return new Route(primary, null, null);
    }

    public boolean hasSuccess() {
        return success != null;
    }

    public boolean hasAlternate() {
        return alternate != null;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

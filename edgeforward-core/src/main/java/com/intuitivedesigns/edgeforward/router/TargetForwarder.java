/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.core.DataUnit;

/**
 * One bounded delivery attempt to one target.
 */
@FunctionalInterface
public interface TargetForwarder {

    /**
     * @return true if the target accepted the unit within the attempt timeout
     */
    boolean forward(String targetId, DataUnit unit, RouteType routeType);
}

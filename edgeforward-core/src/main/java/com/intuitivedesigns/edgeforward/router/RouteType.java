/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

public enum RouteType {
    PRIMARY,
    SUCCESS,
    ALTERNATE
}

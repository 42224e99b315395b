/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.edgeforward.spi;

import com.intuitivedesigns.edgeforward.core.TargetWriter;

/**
 * Creates target writers of one type. Discovered through {@link java.util.ServiceLoader}
 * and selected by {@code target.<id>.type}.
 */
public interface WriterFactory extends ServicePlugin {

    /**
     * @param context target id, its configuration and the result handler the writer must report to
     * @return a new writer; never null
     */
    TargetWriter create(WriterContext context) throws Exception;
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.plugins;

import com.intuitivedesigns.edgeforward.core.DataUnit;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 'Black hole' target for benchmarking. Acknowledges and discards every unit.
 * <p>
 * ID: DEVNULL
 */
public final class DevNullWriterFactory implements WriterFactory {

    public static final String ID = "DEVNULL";
    private static final Logger log = LoggerFactory.getLogger(DevNullWriterFactory.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TargetWriter create(WriterContext context) {
        Objects.requireNonNull(context, "context");

        // WARN so operators are aware data is being discarded
        log.warn("Target '{}' is DEVNULL: all units routed to it are discarded!", context.targetId());
        return new DevNullWriter(new TargetResultHelper(context.targetId(), context.resultHandler()));
    }

    private static final class DevNullWriter implements TargetWriter {
        private final TargetResultHelper results;

        DevNullWriter(TargetResultHelper results) {
            this.results = results;
        }

        @Override
        public void writeTargetData(DataUnit unit) {
            results.ack(unit);
        }
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.plugins;

import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.TargetResultHelper;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.spi.WriterContext;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Target that writes each unit to the application log and acknowledges it immediately.
 * Useful for development, commissioning, or as an alternate target of last resort.
 * <p>
 * ID: LOG
 */
public final class LogWriterFactory implements WriterFactory {

    public static final String ID = "LOG";

    // Target keys (below target.<id>.)
    static final String CFG_LOG_LEVEL = "log.level";
    static final String CFG_MAX_LOG_CHARS = "log.max.chars";
    static final String CFG_LOG_PAYLOAD = "log.payload.enabled";

    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int DEFAULT_MAX_LOG_CHARS = 1024;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public TargetWriter create(WriterContext context) {
        Objects.requireNonNull(context, "context");
        final TargetConfiguration target = context.target();

        final String level = target.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL).toUpperCase(Locale.ROOT);
        final int maxChars = clampInt(target.getInt(CFG_MAX_LOG_CHARS, DEFAULT_MAX_LOG_CHARS), 0, 1_048_576);
        final boolean logPayload = target.getBoolean(CFG_LOG_PAYLOAD, true);

        return new LogTargetWriter(context.targetId(), level, maxChars, logPayload,
                new TargetResultHelper(context.targetId(), context.resultHandler()));
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}

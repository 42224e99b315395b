/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.edgeforward.spi;

import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.TargetResultHandler;
import com.intuitivedesigns.edgeforward.metrics.MetricsRuntime;

import java.util.Objects;

/**
 * Everything a {@link WriterFactory} needs to build a writer.
 *
 * @param resultHandler where the writer reports delivery results; null when nobody listens
 */
public record WriterContext(
        String targetId,
        TargetConfiguration target,
        ForwarderConfig config,
        MetricsRuntime metrics,
        TargetResultHandler resultHandler
) {
    public WriterContext {
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
    }
}

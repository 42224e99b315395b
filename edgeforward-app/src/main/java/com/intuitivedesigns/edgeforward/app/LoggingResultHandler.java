/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.app;

import com.intuitivedesigns.edgeforward.core.ReturnedData;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetResultHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Top-level result handler: logs the router's aggregated outcomes and keeps running totals.
 */
final class LoggingResultHandler implements TargetResultHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingResultHandler.class);

    private final LongAdder acked = new LongAdder();
    private final LongAdder failed = new LongAdder();

    @Override
    public void handleResult(TargetResult result) {
        acked.add(result.acked().size());
        failed.add(result.nacked().size() + result.errored().size());

        if (!result.errored().isEmpty() || !result.nacked().isEmpty()) {
            log.warn("[{}] delivery failed for {} unit(s)", result.targetId(),
                    result.nacked().size() + result.errored().size());
        } else if (log.isDebugEnabled()) {
            log.debug("[{}] delivered {} unit(s)", result.targetId(), result.acked().size());
        }
    }

    @Override
    public ReturnedData returnedData() {
        return ReturnedData.SERIALS;
    }

    long ackedTotal() {
        return acked.sum();
    }

    long failedTotal() {
        return failed.sum();
    }
}

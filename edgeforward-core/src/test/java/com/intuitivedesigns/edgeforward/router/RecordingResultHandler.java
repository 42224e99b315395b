/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.core.SerialUnit;
import com.intuitivedesigns.edgeforward.core.TargetResult;
import com.intuitivedesigns.edgeforward.core.TargetResultHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Upstream handler capturing what the router reports.
 */
final class RecordingResultHandler implements TargetResultHandler {

    final List<Long> acked = new CopyOnWriteArrayList<>();
    final List<Long> errored = new CopyOnWriteArrayList<>();

    @Override
    public void handleResult(TargetResult result) {
        result.acked().stream().map(SerialUnit::serial).forEach(acked::add);
        result.nacked().stream().map(SerialUnit::serial).forEach(errored::add);
        result.errored().stream().map(SerialUnit::serial).forEach(errored::add);
    }

    int reported() {
        return acked.size() + errored.size();
    }
}

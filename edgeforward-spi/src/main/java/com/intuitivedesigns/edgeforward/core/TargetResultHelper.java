/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Reports outcomes for one target to an optional {@link TargetResultHandler},
 * trimming each list to what the handler declared in {@link TargetResultHandler#returnedData()}.
 *
 * <p>A handler failure is logged, never propagated to the reporting writer.</p>
 */
public final class TargetResultHelper {

    private static final Logger log = LoggerFactory.getLogger(TargetResultHelper.class);

    private final String targetId;
    private final TargetResultHandler handler;
    private final ReturnedData returnedData;

    public TargetResultHelper(String targetId, TargetResultHandler handler) {
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.handler = handler;
        this.returnedData = resolveReturnedData(handler);
    }

    public boolean hasHandler() {
        return handler != null;
    }

    public ReturnedData returnedData() {
        return returnedData;
    }

    public void ack(DataUnit unit) {
        returnResults(List.of(unit), List.of(), List.of());
    }

    public void ack(Collection<DataUnit> units) {
        returnResults(units, List.of(), List.of());
    }

    public void nack(DataUnit unit) {
        returnResults(List.of(), List.of(unit), List.of());
    }

    public void nack(Collection<DataUnit> units) {
        returnResults(List.of(), units, List.of());
    }

    public void error(DataUnit unit) {
        returnResults(List.of(), List.of(), List.of(unit));
    }

    public void error(Collection<DataUnit> units) {
        returnResults(List.of(), List.of(), units);
    }

    public void returnResults(Collection<DataUnit> acked, Collection<DataUnit> nacked, Collection<DataUnit> errored) {
        if (handler == null) return;

        final TargetResult result = new TargetResult(
                targetId,
                trim(acked, returnedData.ack()),
                trim(nacked, returnedData.nack()),
                trim(errored, returnedData.error())
        );
        if (result.isEmpty()) return;

        try {
            handler.handleResult(result);
            if (log.isTraceEnabled()) {
                log.trace("Target '{}' reported ack={} nack={} error={}",
                        targetId, serials(acked), serials(nacked), serials(errored));
            }
        } catch (Exception e) {
            log.error("Target '{}' failed reporting results for serials ack={} nack={} error={}",
                    targetId, serials(acked), serials(nacked), serials(errored), e);
        }
    }

    private static List<SerialUnit> trim(Collection<DataUnit> units, ReturnedData.Content content) {
        if (units == null || units.isEmpty() || content == ReturnedData.Content.NONE) return List.of();

        final List<SerialUnit> out = new ArrayList<>(units.size());
        for (DataUnit u : units) {
            if (u == null) continue;
            out.add(content == ReturnedData.Content.MESSAGES ? SerialUnit.of(u) : SerialUnit.serialOnly(u));
        }
        return out;
    }

    private static List<Long> serials(Collection<DataUnit> units) {
        if (units == null || units.isEmpty()) return List.of();
        final List<Long> out = new ArrayList<>(units.size());
        for (DataUnit u : units) {
            if (u != null) out.add(u.serial());
        }
        return out;
    }

    private static ReturnedData resolveReturnedData(TargetResultHandler handler) {
        if (handler == null) return ReturnedData.NONE;
        final ReturnedData declared = handler.returnedData();
        return (declared != null) ? declared : ReturnedData.NONE;
    }
}

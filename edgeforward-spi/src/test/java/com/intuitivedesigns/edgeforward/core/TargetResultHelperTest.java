/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TargetResultHelperTest {

    private static DataUnit unit(long serial) {
        return new DataUnit(serial, "s", "p", Map.of(), null, false);
    }

    private static final class Capture implements TargetResultHandler {
        final List<TargetResult> results = new ArrayList<>();
        final ReturnedData returned;

        Capture(ReturnedData returned) {
            this.returned = returned;
        }

        @Override
        public void handleResult(TargetResult result) {
            results.add(result);
        }

        @Override
        public ReturnedData returnedData() {
            return returned;
        }
    }

    @Test
    void returnResults_shouldHonourDeclaredContent() {
        Capture handler = new Capture(new ReturnedData(
                ReturnedData.Content.MESSAGES, ReturnedData.Content.SERIALS, ReturnedData.Content.NONE));
        TargetResultHelper helper = new TargetResultHelper("t1", handler);

        helper.returnResults(List.of(unit(1)), List.of(unit(2)), List.of(unit(3)));

        assertEquals(1, handler.results.size());
        TargetResult r = handler.results.get(0);
        assertEquals("t1", r.targetId());
        assertTrue(r.acked().get(0).hasUnit());
        assertEquals(2L, r.nacked().get(0).serial());
        assertFalse(r.nacked().get(0).hasUnit());
        assertTrue(r.errored().isEmpty());
    }

    @Test
    void returnResults_shouldSkipEmptyResults() {
        Capture handler = new Capture(new ReturnedData(
                ReturnedData.Content.MESSAGES, ReturnedData.Content.NONE, ReturnedData.Content.NONE));
        TargetResultHelper helper = new TargetResultHelper("t1", handler);

        helper.error(unit(1));
        helper.nack(List.of(unit(2), unit(3)));

        assertTrue(handler.results.isEmpty());
    }

    @Test
    void withoutHandler_nothingIsReported() {
        TargetResultHelper helper = new TargetResultHelper("t1", null);

        assertFalse(helper.hasHandler());
        assertEquals(ReturnedData.NONE, helper.returnedData());
        assertDoesNotThrow(() -> helper.ack(unit(1)));
    }

    @Test
    void handlerFailure_isContained() {
        TargetResultHelper helper = new TargetResultHelper("t1", result -> {
            throw new IllegalStateException("handler down");
        });

        assertDoesNotThrow(() -> helper.ack(unit(1)));
    }

    @Test
    void dataUnit_serialsAreUniqueAndIncreasing() {
        DataUnit a = DataUnit.create("s", "x", false);
        DataUnit b = DataUnit.create("s", "y", Map.of("k", "v"), true);

        assertTrue(b.serial() > a.serial());
        assertNotNull(a.timestamp());
        assertEquals("v", b.metadata().get("k"));
        assertTrue(b.noBuffering());
    }
}

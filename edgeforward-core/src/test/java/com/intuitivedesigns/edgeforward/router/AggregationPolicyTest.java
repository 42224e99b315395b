/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregationPolicyTest {

    @Test
    void allTargets_requiresEveryRoute() {
        assertTrue(AggregationPolicy.ALL_TARGETS.combine(List.of(true, true)));
        assertFalse(AggregationPolicy.ALL_TARGETS.combine(List.of(true, false)));
        assertFalse(AggregationPolicy.ALL_TARGETS.combine(List.of(false, false)));
    }

    @Test
    void anyTarget_requiresOneRoute() {
        assertTrue(AggregationPolicy.ANY_TARGET.combine(List.of(false, true)));
        assertTrue(AggregationPolicy.ANY_TARGET.combine(List.of(true, true)));
        assertFalse(AggregationPolicy.ANY_TARGET.combine(List.of(false, false)));
    }

    @Test
    void combine_noRoutesIsFailure() {
        assertFalse(AggregationPolicy.ALL_TARGETS.combine(List.of()));
        assertFalse(AggregationPolicy.ANY_TARGET.combine(null));
    }

    @Test
    void parse_shouldDefaultAndNormalize() {
        assertEquals(AggregationPolicy.ALL_TARGETS, AggregationPolicy.parse(null, "k"));
        assertEquals(AggregationPolicy.ANY_TARGET, AggregationPolicy.parse(" any_target ", "k"));
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> AggregationPolicy.parse("MOST", "router.r.policy"));
        assertEquals("router.r.policy", e.item());
    }
}

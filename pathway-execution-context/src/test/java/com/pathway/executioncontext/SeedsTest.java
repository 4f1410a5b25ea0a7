package com.pathway.executioncontext;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeedsTest {

    @Test
    void fromSessionId_isStableAcrossCalls() {
        assertEquals(Seeds.fromSessionId("session-42"), Seeds.fromSessionId("session-42"));
        assertNotEquals(Seeds.fromSessionId("session-42"), Seeds.fromSessionId("session-43"));
    }

    @Test
    void forNode_separatesNodesAndPurposes() {
        long seed = Seeds.fromSessionId("p1");

        assertEquals(Seeds.forNode(seed, "block_a"), Seeds.forNode(seed, "block_a"));
        assertNotEquals(Seeds.forNode(seed, "block_a"), Seeds.forNode(seed, "block_b"));
        assertNotEquals(Seeds.forNode(seed, "block_a", "pick"), Seeds.forNode(seed, "block_a", "order"));
    }

    @Test
    void fromSessionId_spreadsSequentialIds() {
        Set<Long> lowBits = new HashSet<>();
        for (int i = 0; i < 64; i++) {
            lowBits.add(Seeds.fromSessionId("sim_" + i) & 0xff);
        }
        // 64 draws over 256 buckets: a good mixer lands well above half distinct
        assertTrue(lowBits.size() > 40, "distinct low bytes: " + lowBits.size());
    }
}

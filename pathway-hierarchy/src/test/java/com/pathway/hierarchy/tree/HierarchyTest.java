package com.pathway.hierarchy.tree;

import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.config.ExperimentDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pathway.hierarchy.ExperimentFixtures.fixture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyTest {

    private Hierarchy hierarchy;

    @BeforeEach
    void setUp() {
        hierarchy = Hierarchy.from(HierarchyConfig.fromJson(fixture("reading-study.json")));
    }

    @Test
    void from_buildsFlatArenaUnderSyntheticRoot() {
        assertEquals("reading-study", hierarchy.getRootId());
        assertEquals(HierarchyLevel.EXPERIMENT, hierarchy.root().getLevel());
        assertEquals(List.of("consent", "main"), hierarchy.childIds("reading-study"));
        assertEquals(List.of("arm_a", "arm_b"), hierarchy.childIds("main"));
        assertEquals("main", hierarchy.parentId("arm_b"));
        assertNull(hierarchy.parentId("reading-study"));
    }

    @Test
    void from_infersLevelsFromDepth() {
        assertEquals(HierarchyLevel.PHASE, hierarchy.level("main"));
        assertEquals(HierarchyLevel.STAGE, hierarchy.level("arm_a"));
        assertEquals(HierarchyLevel.BLOCK, hierarchy.level("b_block"));
        assertEquals(HierarchyLevel.TASK, hierarchy.level("b_2"));
        assertTrue(hierarchy.isTask("b_2"));
        assertFalse(hierarchy.isTask("b_block"));
    }

    @Test
    void nextSiblingId_returnsFollowingSiblingOrNull() {
        assertEquals("arm_b", hierarchy.nextSiblingId("arm_a"));
        assertNull(hierarchy.nextSiblingId("arm_b"));
        assertEquals("b_3", hierarchy.nextSiblingId("b_2"));
    }

    @Test
    void ancestry_listsRootFirst() {
        assertEquals(List.of("reading-study", "main", "arm_b", "b_block", "b_1"), hierarchy.ancestry("b_1"));
        assertTrue(hierarchy.ancestry("nope").isEmpty());
    }

    @Test
    void effectivePickAssigns_prefersOwnValuesElseAggregatesDescendants() {
        assertEquals(Map.of("topic", List.of("climate")), hierarchy.effectivePickAssigns("a_climate"));
        assertEquals(Map.of("topic", List.of("climate", "health")), hierarchy.effectivePickAssigns("arm_a"));
        assertEquals(Map.of("topic", List.of("climate", "health")), hierarchy.effectivePickAssigns("main"));
        assertTrue(hierarchy.effectivePickAssigns("arm_b").isEmpty());
    }

    @Test
    void requireNode_unknownIdThrowsConfigurationException() {
        assertThrows(ConfigurationException.class, () -> hierarchy.requireNode("missing"));
    }

    @Test
    void from_duplicateIdThrows() {
        ExperimentDefinition def = HierarchyConfig.fromJson("""
                {"experiment_id":"dup","phases":[{"id":"p","children":[{"id":"x"},{"id":"x"}]}]}
                """);
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> Hierarchy.from(def));
        assertTrue(e.getMessage().contains("Duplicate node id: x"));
    }

    @Test
    void from_levelKeyDecidesLevelWhenBlocksAreSkipped() {
        Hierarchy flat = Hierarchy.from(HierarchyConfig.fromJson("""
                {"experiment_id": "flat", "phases": [
                  {"id": "p", "stages": [ {"id": "s", "tasks": [ {"id": "t"} ]} ]}
                ]}
                """));

        assertEquals(HierarchyLevel.STAGE, flat.level("s"));
        assertTrue(flat.isTask("t"));
    }
}

package com.pathway.service;

import com.pathway.config.PathwayConfig;
import com.pathway.distribution.DistributionCounts;
import com.pathway.engine.TraversalResult;
import com.pathway.engine.paths.PathTreeNode;
import com.pathway.engine.variables.ExtractedVariable;
import com.pathway.engine.variables.VariableType;
import com.pathway.features.quota.QuotaArbiter;
import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.config.ExperimentDefinition;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.DecisionType;
import com.pathway.simulator.InvalidDistributionException;
import com.pathway.simulator.PathDistribution;
import com.pathway.simulator.SimulationResult;
import com.pathway.simulator.VariableDistribution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExperimentServiceTest {

    static final String STUDY = """
            {
              "experiment_id": "study",
              "version": "1",
              "phases": [
                { "id": "intro",
                  "stages": [ { "id": "consent", "tasks": [ { "id": "agree" } ] } ] },
                { "id": "p", "rules": { "ordering": "balanced" },
                  "stages": [
                    { "id": "a", "tasks": [ { "id": "a1" } ] },
                    { "id": "b", "tasks": [ { "id": "b1" } ] },
                    { "id": "c", "tasks": [ { "id": "c1" } ] }
                  ] },
                { "id": "followup",
                  "stages": [
                    { "id": "adults", "visibility_rule": "participant.age >= 18", "tasks": [ { "id": "f1" } ] }
                  ] }
              ]
            }
            """;

    static final String INVALID = """
            {
              "experiment_id": "broken",
              "phases": [
                { "id": "p",
                  "stages": [
                    { "id": "s", "rules": { "quota": { "limit": 2, "strategy": "show_alternative" } },
                      "tasks": [ { "id": "t" } ] }
                  ] }
              ]
            }
            """;

    private ExperimentService service;

    @BeforeEach
    void setUp() {
        service = new ExperimentService(config().build());
        service.publish(definition(STUDY));
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private static PathwayConfig.Builder config() {
        return PathwayConfig.builder()
                .ledger(PathwayConfig.LedgerBackend.MEMORY)
                .quotaWaitTimeoutMs(0)
                .simulationParallelism(2);
    }

    private static ExperimentDefinition definition(String json) {
        return HierarchyConfig.fromJson(json);
    }

    private static long startedAt(Map<String, DistributionCounts> level) {
        return level.values().stream().mapToLong(DistributionCounts::getStarted).sum();
    }

    @Test
    void publish_rejectsInvalidDefinitionWithAllErrors() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> service.publish(definition(INVALID)));

        assertTrue(e.getErrors().stream().anyMatch(err -> err.contains("show_alternative requires fallback_node_id")),
                "errors " + e.getErrors());
        assertThrows(UnknownExperimentException.class, () -> service.distribution("broken"));
    }

    @Test
    void completeTask_walksTheParticipantThroughEveryVisibleStage() {
        service.startSession("study", "s1", Map.of("age", 30));

        TraversalResult first = service.nextTask("s1");
        assertEquals("agree", first.getTaskId());

        TraversalResult balanced = service.completeTask("s1", "agree", Map.of("consent", true));
        String chosenTask = balanced.getTaskId();
        assertTrue(Set.of("a1", "b1", "c1").contains(chosenTask), chosenTask);

        assertEquals("f1", service.completeTask("s1", chosenTask, null).getTaskId());
        TraversalResult done = service.completeTask("s1", "f1", Map.of());

        assertEquals(TraversalResult.Status.COMPLETE, done.getStatus());
        String chosenStage = chosenTask.substring(0, 1);
        assertEquals(new DistributionCounts(1, 1, 0), service.distribution("study").get("p").get(chosenStage));
    }

    @Test
    void completeTask_storesResponsesUnderTheStageId() {
        Session session = service.startSession("study", "s1", null);
        service.nextTask("s1");

        service.completeTask("s1", "agree", Map.of("consent", true));

        assertEquals(Map.of("consent", true), session.getState().getResponses().get("consent"));
    }

    @Test
    void nextTask_skipsStagesHiddenByParticipantAttributes() {
        service.startSession("study", "minor", Map.of("age", 12));
        service.nextTask("minor");
        String chosenTask = service.completeTask("minor", "agree", null).getTaskId();

        TraversalResult done = service.completeTask("minor", chosenTask, null);

        assertEquals(TraversalResult.Status.COMPLETE, done.getStatus());
        assertFalse(done.getPath().contains("f1"), "path " + done.getPath());
    }

    @Test
    void startSession_returnsTheExistingSessionForTheSameId() {
        Session first = service.startSession("study", "s1", Map.of("age", 30));
        Session again = service.startSession("study", "s1", Map.of("age", 50));

        assertSame(first, again);
        assertEquals(30, again.getState().getEnvironment().get("age"));
    }

    @Test
    void startSession_unknownExperimentIsRejected() {
        assertThrows(UnknownExperimentException.class, () -> service.startSession("nope", "s1", null));
    }

    @Test
    void completeTask_unknownTaskIsRejected() {
        service.startSession("study", "s1", null);

        assertThrows(IllegalArgumentException.class, () -> service.completeTask("s1", "p", null));
    }

    @Test
    void assignmentHistory_listsAssignmentsAndOrderingDecision() {
        service.startSession("study", "s1", null);
        service.nextTask("s1");
        service.completeTask("s1", "agree", null);

        AssignmentHistory history = service.assignmentHistory("s1");

        assertEquals("s1", history.getSessionId());
        assertTrue(history.getAssignments().containsKey("p"));
        List<AssignmentRecord> ordering = history.getRecords().stream()
                .filter(r -> r.getDecisionType() == DecisionType.ORDERING && "p".equals(r.getAssignmentKey()))
                .toList();
        assertEquals(1, ordering.size());
        assertEquals(history.getAssignments().get("p"), ordering.get(0).getAssignedChildIds());
    }

    @Test
    void assignmentHistory_unknownSessionIsRejected() {
        assertThrows(UnknownSessionException.class, () -> service.assignmentHistory("ghost"));
    }

    @Test
    void abandonSession_releasesItsClaimAndKeepsHistory() {
        service.startSession("study", "stay", null);
        service.nextTask("stay");
        service.completeTask("stay", "agree", null);
        service.startSession("study", "leave", null);
        service.nextTask("leave");
        service.completeTask("leave", "agree", null);
        String leftStage = service.assignmentHistory("leave").getAssignments().get("p").get(0);
        String stayedStage = service.assignmentHistory("stay").getAssignments().get("p").get(0);
        assertNotEquals(stayedStage, leftStage);

        service.abandonSession("leave");

        Map<String, DistributionCounts> counts = service.distribution("study").get("p");
        assertEquals(DistributionCounts.ZERO, counts.getOrDefault(leftStage, DistributionCounts.ZERO));
        assertEquals(new DistributionCounts(1, 0, 1), counts.get(stayedStage));
        assertThrows(UnknownSessionException.class, () -> service.nextTask("leave"));
        assertEquals(leftStage, service.assignmentHistory("leave").getAssignments().get("p").get(0));
    }

    @Test
    void resetCounters_clearsOneLevelOrEverything() {
        service.startSession("study", "s1", null);
        service.nextTask("s1");
        service.completeTask("s1", "agree", null);
        assertEquals(1, startedAt(service.distribution("study").get("p")));

        service.resetCounters("study", "p");
        assertTrue(service.distribution("study").getOrDefault("p", Map.of()).isEmpty());

        assertThrows(ConfigurationException.class, () -> service.resetCounters("study", "missing"));
        service.resetCounters("study", null);
        assertTrue(service.distribution("study").values().stream().allMatch(Map::isEmpty));
    }

    @Test
    void resetCounters_reopensQuotaOfTheResetLevel() {
        service.publish(definition("""
                {
                  "experiment_id": "gated",
                  "phases": [
                    { "id": "gate",
                      "stages": [
                        { "id": "full", "rules": { "quota": { "limit": 1, "strategy": "skip_if_full", "fallback_node_id": "open" } },
                          "tasks": [ { "id": "f1" } ] },
                        { "id": "open", "tasks": [ { "id": "o1" } ] }
                      ] }
                  ]
                }
                """));
        service.startSession("gated", "q1", null);
        assertEquals("f1", service.nextTask("q1").getTaskId());
        service.startSession("gated", "q2", null);
        assertEquals("o1", service.nextTask("q2").getTaskId());
        assertEquals(1, service.distribution("gated").get(QuotaArbiter.QUOTA_LEVEL).get("full").getStarted());

        service.resetCounters("gated", "gate");

        assertEquals(DistributionCounts.ZERO, service.distribution("gated")
                .getOrDefault(QuotaArbiter.QUOTA_LEVEL, Map.of()).getOrDefault("full", DistributionCounts.ZERO));
        service.startSession("gated", "q3", null);
        assertEquals("f1", service.nextTask("q3").getTaskId());
    }

    @Test
    void publish_newVersionDropsSessionsOfTheOldOne() {
        service.startSession("study", "s1", null);

        service.publish(definition(STUDY.replace("\"version\": \"1\"", "\"version\": \"2\"")));

        assertThrows(UnknownSessionException.class, () -> service.nextTask("s1"));
        assertTrue(service.distribution("study").values().stream().allMatch(Map::isEmpty));
    }

    @Test
    void paths_wrapsBalancedChildrenInAnOrderGroup() {
        PathTreeNode root = service.paths("study");

        assertEquals("experiment", root.getType());
        PathTreeNode balancedPhase = root.childList().get(1);
        assertEquals("p", balancedPhase.getId());
        PathTreeNode group = balancedPhase.childList().get(0);
        assertEquals(PathTreeNode.ORDER_GROUP, group.getType());
        assertEquals("Balanced Distribution", group.getLabel());
        assertEquals(3, group.childList().size());
    }

    @Test
    void simulateVariables_findsVisibilityVariables() {
        List<ExtractedVariable> variables = service.simulateVariables("study");

        ExtractedVariable age = variables.stream().filter(v -> v.getPath().equals("participant.age")).findFirst().orElseThrow();
        assertEquals(VariableType.NUMERIC, age.getType());
    }

    @Test
    void simulate_leavesTheLiveDistributionUnchanged() {
        service.startSession("study", "live", null);
        service.nextTask("live");
        service.completeTask("live", "agree", null);
        Map<String, Map<String, DistributionCounts>> before = service.distribution("study");

        SimulationResult result = service.simulate("study", 1000,
                Map.of("participant.age", VariableDistribution.numeric(10, 60, VariableDistribution.UNIFORM)), true);

        assertEquals(before, service.distribution("study"));
        assertEquals(1000, result.getTotalParticipants());
        assertEquals(1000, result.getPathDistributions().stream().mapToLong(PathDistribution::getCount).sum());
        assertEquals(1001, startedAt(result.getSimulatedCounts().get("p")));
        assertTrue(result.getPathDistributions().stream().anyMatch(d -> d.getPath().contains("f1")));
        assertTrue(result.getPathDistributions().stream().anyMatch(d -> !d.getPath().contains("f1")));
    }

    @Test
    void simulate_invalidDistributionFailsBeforeRunning() {
        assertThrows(InvalidDistributionException.class, () -> service.simulate("study", 10,
                Map.of("participant.age", VariableDistribution.numeric(60, 10, VariableDistribution.UNIFORM)), false));
    }

    @Test
    void loadAndPublish_readsTheExperimentDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("study-7.json"), STUDY.replace("\"version\": \"1\"", "\"version\": \"7\""),
                StandardCharsets.UTF_8);
        try (ExperimentService fromDir = new ExperimentService(config().experimentDir(dir.toString()).build())) {
            ExperimentScope scope = fromDir.loadAndPublish("study", "7");

            assertEquals("7", scope.getHierarchy().getVersion());
            assertThrows(ConfigurationException.class, () -> fromDir.loadAndPublish("absent", null));
        }
    }
}

package com.pathway.simulator;

import com.pathway.config.PathwayConfig;
import com.pathway.distribution.DistributionCounts;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.engine.TraversalResult;
import com.pathway.engine.variables.ExtractedVariable;
import com.pathway.engine.variables.VariableExtractor;
import com.pathway.engine.variables.VariableType;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.rules.RuleEvaluationPolicy;
import com.pathway.rules.RuleEvaluator;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathSimulatorTest {

    static final String BALANCED = """
            {
              "experiment_id": "balanced-study",
              "phases": [
                { "id": "p", "rules": { "ordering": "balanced" },
                  "stages": [
                    { "id": "a", "tasks": [ { "id": "a1" } ] },
                    { "id": "b", "tasks": [ { "id": "b1" } ] },
                    { "id": "c", "tasks": [ { "id": "c1" } ] }
                  ] }
              ]
            }
            """;

    static final String CONDITIONAL = """
            {
              "experiment_id": "conditional-study",
              "phases": [
                { "id": "main",
                  "stages": [
                    { "id": "everyone", "tasks": [ { "id": "t0" } ] },
                    { "id": "adults", "visibility_rule": "participant.age >= 18", "tasks": [ { "id": "t1" } ] }
                  ] }
              ]
            }
            """;

    private static PathSimulator simulator(String json, int parallelism) {
        return new PathSimulator(Hierarchy.from(HierarchyConfig.fromJson(json)),
                new RuleEvaluator(RuleEvaluationPolicy.FAIL_OPEN),
                PathwayConfig.builder().simulationParallelism(parallelism).simulationMaxParticipants(20_000).build());
    }

    private static long spread(Map<String, DistributionCounts> counts) {
        long max = counts.values().stream().mapToLong(DistributionCounts::getStarted).max().orElse(0);
        long min = counts.values().stream().mapToLong(DistributionCounts::getStarted).min().orElse(0);
        return max - min;
    }

    @Test
    void simulate_balancedSpreadsParticipantsEvenly() {
        SimulationResult result = simulator(BALANCED, 4).simulate(9000, Map.of());

        Map<String, DistributionCounts> counts = result.getSimulatedCounts().get("p");
        assertEquals(9000, counts.values().stream().mapToLong(DistributionCounts::getStarted).sum());
        assertTrue(spread(counts) <= 1, "counts " + counts);
        assertEquals(3, result.getPathDistributions().size());
        for (PathDistribution path : result.getPathDistributions()) {
            assertEquals(TraversalResult.Status.COMPLETE, path.getStatus());
            assertEquals(3000, path.getCount());
            assertEquals(33.33, path.getPercentage());
        }
    }

    @Test
    void simulate_neverTouchesTheLiveStore() {
        InMemoryDistributionStore live = new InMemoryDistributionStore();
        for (int i = 0; i < 5; i++) live.claim("p", "a");
        Map<String, Map<String, DistributionCounts>> before = live.snapshotAll();

        SimulationResult result = simulator(BALANCED, 4).simulate(1000, Map.of(), live.snapshotAll());

        assertEquals(before, live.snapshotAll());
        Map<String, DistributionCounts> simulated = result.getSimulatedCounts().get("p");
        assertEquals(1005, simulated.values().stream().mapToLong(DistributionCounts::getStarted).sum());
        assertTrue(spread(simulated) <= 1, "counts " + simulated);
    }

    @Test
    void simulate_bucketsPathsByVisibilityOutcome() {
        SimulationResult result = simulator(CONDITIONAL, 2).simulate(2000,
                Map.of("participant.age", VariableDistribution.numeric(0, 100, "uniform")));

        List<PathDistribution> paths = result.getPathDistributions();
        assertEquals(2, paths.size());
        assertEquals(List.of("t0", "t1"), paths.get(0).getPath());
        assertEquals("t0 → t1", paths.get(0).getPathDisplay());
        assertTrue(paths.get(0).getPercentage() > 78 && paths.get(0).getPercentage() < 86, paths.toString());
        assertEquals(List.of("t0"), paths.get(1).getPath());
        assertEquals(2000, paths.get(0).getCount() + paths.get(1).getCount());

        Map<String, Long> ages = result.getVariableSummary().get("participant.age");
        assertEquals(10, ages.size());
        assertEquals("0.00-10.00", ages.keySet().iterator().next());
        assertEquals(2000, ages.values().stream().mapToLong(Long::longValue).sum());
    }

    @Test
    void simulate_summarizesCategoricalAndBooleanDraws() {
        SimulationResult result = simulator(CONDITIONAL, 2).simulate(4000, Map.of(
                "participant.country", VariableDistribution.categorical(Map.of("US", 3.0, "CA", 1.0)),
                "env.beta", VariableDistribution.bool(0.2)));

        Map<String, Long> country = result.getVariableSummary().get("participant.country");
        assertEquals(List.of("CA", "US"), List.copyOf(country.keySet()));
        assertTrue(country.get("US") > 2850 && country.get("US") < 3150, country.toString());
        Map<String, Long> beta = result.getVariableSummary().get("env.beta");
        assertTrue(beta.get("true") > 700 && beta.get("true") < 900, beta.toString());
    }

    @Test
    void simulate_singleWorkerIsReproducible() {
        PathSimulator simulator = simulator(BALANCED, 1);

        List<String> first = simulator.simulate(300, Map.of()).getPathDistributions().stream()
                .map(PathDistribution::toString).collect(Collectors.toList());
        List<String> second = simulator.simulate(300, Map.of()).getPathDistributions().stream()
                .map(PathDistribution::toString).collect(Collectors.toList());

        assertEquals(first, second);
    }

    @Test
    void simulate_invalidRequestFailsBeforeRunning() {
        PathSimulator simulator = simulator(CONDITIONAL, 2);

        InvalidDistributionException e = assertThrows(InvalidDistributionException.class, () -> simulator.simulate(0, Map.of(
                "participant.age", VariableDistribution.numeric(50, 10, "uniform"),
                "participant.country", VariableDistribution.categorical(Map.of("US", -1.0)),
                "env.beta", VariableDistribution.bool(1.5))));

        assertEquals(5, e.getErrors().size(), e.getErrors().toString());
        assertTrue(e.getErrors().contains("participantCount must be between 1 and 20000 (was 0)"));
    }

    @Test
    void simulate_everyExtractedVariableReachesItsRule() {
        String json = """
                {
                  "experiment_id": "bracket-study",
                  "phases": [
                    { "id": "main",
                      "stages": [
                        { "id": "everyone", "tasks": [ { "id": "t0" } ] },
                        { "id": "agreed", "visibility_rule": "responses['consent'].agree == true", "tasks": [ { "id": "t1" } ] },
                        { "id": "screened", "visibility_rule": "scores['phq9'] >= 10", "tasks": [ { "id": "t2" } ] }
                      ] }
                  ]
                }
                """;
        RuleEvaluator evaluator = new RuleEvaluator(RuleEvaluationPolicy.FAIL_CLOSED);
        Hierarchy hierarchy = Hierarchy.from(HierarchyConfig.fromJson(json));
        Map<String, VariableDistribution> distributions = new LinkedHashMap<>();
        for (ExtractedVariable variable : new VariableExtractor(evaluator).extract(hierarchy)) {
            distributions.put(variable.getPath(), variable.getType() == VariableType.BOOLEAN
                    ? VariableDistribution.bool(1.0)
                    : VariableDistribution.numeric(10, 20, VariableDistribution.UNIFORM));
        }
        assertEquals(List.of("responses['consent'].agree", "scores['phq9']"), List.copyOf(distributions.keySet()));

        SimulationResult result = new PathSimulator(hierarchy, evaluator, PathwayConfig.builder().simulationParallelism(2).build())
                .simulate(10, distributions);

        assertEquals(1, result.getPathDistributions().size());
        assertEquals(List.of("t0", "t1", "t2"), result.getPathDistributions().get(0).getPath());
        assertEquals(10, result.getPathDistributions().get(0).getCount());
    }

    @Test
    void simulate_malformedVariablePathFailsBeforeRunning() {
        PathSimulator simulator = simulator(CONDITIONAL, 2);

        InvalidDistributionException e = assertThrows(InvalidDistributionException.class,
                () -> simulator.simulate(10, Map.of(".", VariableDistribution.bool(1.0))));

        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).startsWith(".: not a variable path"), e.getErrors().toString());
    }
}

package com.pathway.simulator;

import com.pathway.config.PathwayConfig;
import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.DistributionCounts;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.distribution.InMemorySequenceCounters;
import com.pathway.engine.PathResolver;
import com.pathway.engine.TraversalResult;
import com.pathway.engine.variables.VariableType;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.rules.RuleEvaluator;
import com.pathway.rules.VariablePath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the path resolver for synthetic participants and aggregates the paths they take.
 * <p>
 * Each run owns a private in-memory distribution store (optionally starting from a copy of live counts) and
 * private sequence counters; decisions are not written to the assignment ledger. Participant {@code i} is session
 * {@code sim_<i>} and draws its variable values from a generator seeded with {@code i * 12345}. Participants run
 * on a bounded pool; each walks to the end, completing every task it reaches.
 */
public final class PathSimulator {

    private static final Logger log = LoggerFactory.getLogger(PathSimulator.class);

    static final int NUMERIC_BINS = 10;

    private final Hierarchy hierarchy;
    private final RuleEvaluator evaluator;
    private final PathwayConfig config;

    public PathSimulator(Hierarchy hierarchy, RuleEvaluator evaluator, PathwayConfig config) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.config = Objects.requireNonNull(config, "config");
    }

    public SimulationResult simulate(int participantCount, Map<String, VariableDistribution> distributions) {
        return simulate(participantCount, distributions, null);
    }

    /**
     * @param seedCounts live counts to start from; null for empty counters. Only read.
     * @throws InvalidDistributionException before anything runs when the request is invalid
     */
    public SimulationResult simulate(int participantCount, Map<String, VariableDistribution> distributions,
                                     Map<String, Map<String, DistributionCounts>> seedCounts) {
        DistributionValidator.validate(participantCount, config.getSimulationMaxParticipants(), distributions);
        Map<String, VariableDistribution> variables = distributions != null ? new LinkedHashMap<>(distributions) : Map.of();
        long startedAt = System.currentTimeMillis();

        InMemoryDistributionStore store = InMemoryDistributionStore.copyOf(seedCounts);
        PathResolver resolver = PathResolver.builder(hierarchy)
                .evaluator(evaluator)
                .store(store)
                .sequences(new InMemorySequenceCounters())
                .recorder(AssignmentRecorder.noOp())
                .retry(new ConflictRetry(config.getConflictMaxRetries()))
                .maxRedirects(config.getMaxRedirects())
                .build();

        List<SimulatedParticipant> participants = run(resolver, participantCount, variables);
        List<PathDistribution> paths = aggregatePaths(participants);
        Map<String, Map<String, Long>> summary = summarizeVariables(participants, variables);

        log.info("Simulation finished | experimentId={} | participants={} | distinctPaths={} | tookMs={}",
                hierarchy.getExperimentId(), participantCount, paths.size(), System.currentTimeMillis() - startedAt);
        return new SimulationResult(hierarchy.getExperimentId(), participantCount, paths, summary, store.snapshotAll());
    }

    private List<SimulatedParticipant> run(PathResolver resolver, int participantCount,
                                           Map<String, VariableDistribution> variables) {
        int threads = Math.max(1, Math.min(config.getSimulationParallelism(), participantCount));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SimulatedParticipant>> futures = new ArrayList<>(participantCount);
            for (int i = 0; i < participantCount; i++) {
                int index = i;
                futures.add(pool.submit(() -> simulateOne(resolver, index, variables)));
            }
            List<SimulatedParticipant> out = new ArrayList<>(participantCount);
            for (Future<SimulatedParticipant> future : futures) {
                out.add(future.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Simulated participant failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private SimulatedParticipant simulateOne(PathResolver resolver, int index, Map<String, VariableDistribution> variables) {
        ParticipantState state = ParticipantState.forSession("sim_" + index);
        SplittableRandom rng = new SplittableRandom(index * 12345L);
        Map<String, Object> values = new LinkedHashMap<>();
        variables.forEach((path, distribution) -> {
            Object value = distribution.sample(rng);
            if (value != null) {
                VariablePath.parse(path).assign(state, value);
                values.put(path, value);
            }
        });
        TraversalResult result = resolver.runToEnd(state);
        if (result.getStatus() != TraversalResult.Status.COMPLETE) {
            resolver.abandon(state);
        }
        return new SimulatedParticipant(index, result, new LinkedHashMap<>(state.getAssignments()), values);
    }

    static List<PathDistribution> aggregatePaths(List<SimulatedParticipant> participants) {
        Map<String, List<SimulatedParticipant>> buckets = new LinkedHashMap<>();
        participants.stream()
                .sorted(Comparator.comparingInt(p -> p.index))
                .forEach(p -> buckets.computeIfAbsent(p.result.getStatus() + ":" + String.join("→", p.result.getPath()),
                        k -> new ArrayList<>()).add(p));
        int total = participants.size();
        List<PathDistribution> out = new ArrayList<>(buckets.size());
        for (List<SimulatedParticipant> bucket : buckets.values()) {
            SimulatedParticipant sample = bucket.get(0);
            double percentage = Math.round(bucket.size() * 10_000.0 / total) / 100.0;
            out.add(new PathDistribution(sample.result.getPath(), sample.result.getStatus(), bucket.size(), percentage,
                    sample.assignments));
        }
        out.sort(Comparator.comparingLong(PathDistribution::getCount).reversed());
        return out;
    }

    static Map<String, Map<String, Long>> summarizeVariables(List<SimulatedParticipant> participants,
                                                             Map<String, VariableDistribution> variables) {
        Map<String, Map<String, Long>> summary = new LinkedHashMap<>();
        variables.forEach((path, distribution) -> {
            Map<String, Long> counts;
            if (distribution.getType() == VariableType.NUMERIC) {
                counts = new LinkedHashMap<>();
                double lo = distribution.getMin();
                double hi = distribution.getMax();
                double width = (hi - lo) / NUMERIC_BINS;
                for (int b = 0; b < NUMERIC_BINS; b++) {
                    counts.put(binLabel(lo + b * width, b == NUMERIC_BINS - 1 ? hi : lo + (b + 1) * width), 0L);
                }
                List<String> labels = new ArrayList<>(counts.keySet());
                for (SimulatedParticipant p : participants) {
                    Object value = p.values.get(path);
                    if (!(value instanceof Number)) continue;
                    int bin = width > 0 ? (int) ((((Number) value).doubleValue() - lo) / width) : 0;
                    bin = Math.max(0, Math.min(NUMERIC_BINS - 1, bin));
                    counts.merge(labels.get(bin), 1L, Long::sum);
                }
            } else {
                counts = new TreeMap<>();
                for (SimulatedParticipant p : participants) {
                    Object value = p.values.get(path);
                    if (value != null) counts.merge(String.valueOf(value), 1L, Long::sum);
                }
            }
            summary.put(path, counts);
        });
        return summary;
    }

    private static String binLabel(double from, double to) {
        return String.format(Locale.ROOT, "%.2f-%.2f", from, to);
    }

    static final class SimulatedParticipant {
        final int index;
        final TraversalResult result;
        final Map<String, List<String>> assignments;
        final Map<String, Object> values;

        SimulatedParticipant(int index, TraversalResult result, Map<String, List<String>> assignments, Map<String, Object> values) {
            this.index = index;
            this.result = result;
            this.assignments = assignments;
            this.values = values;
        }
    }
}

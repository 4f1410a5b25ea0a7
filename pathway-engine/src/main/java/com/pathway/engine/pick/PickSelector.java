package com.pathway.engine.pick;

import com.pathway.distribution.SequenceCounters;
import com.pathway.engine.random.Combinations;
import com.pathway.engine.random.Sampling;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.executioncontext.Seeds;
import com.pathway.hierarchy.config.PickConfig;
import com.pathway.hierarchy.config.PickStrategy;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.tree.HierarchyNode;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.ledger.DecisionType;
import com.pathway.rules.RuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.stream.Collectors;

/**
 * Chooses K of N children for a pick group.
 * <p>
 * Candidates are the children whose effective pick assigns satisfy every pick condition. When no more than
 * {@code count} candidates remain, all of them are taken rather than failing the session. Otherwise:
 * {@code random} takes a subset seeded by (participant seed, node id); {@code round_robin} takes the
 * {@code i}-th k-subset of the candidates, {@code i} dispensed by the node's sequence counter;
 * {@code weighted_random} takes the first {@code count} weighted draws without replacement.
 * <p>
 * The chosen ids are stored under the node id and their pick assigns are accumulated into the participant state.
 */
public final class PickSelector {

    private static final Logger log = LoggerFactory.getLogger(PickSelector.class);

    private final Hierarchy hierarchy;
    private final RuleEvaluator evaluator;
    private final SequenceCounters sequences;
    private final AssignmentRecorder recorder;

    public PickSelector(Hierarchy hierarchy, RuleEvaluator evaluator, SequenceCounters sequences, AssignmentRecorder recorder) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.sequences = Objects.requireNonNull(sequences, "sequences");
        this.recorder = recorder != null ? recorder : AssignmentRecorder.noOp();
    }

    /** Sequence counter key of a round-robin pick group. */
    public static String sequenceKey(HierarchyNode node) {
        return node.getId() + "#pick";
    }

    /** Selects from all declared children. */
    public PickResult selectPick(HierarchyNode node, ParticipantState state) {
        return selectPick(node, hierarchy.childIds(node.getId()), state);
    }

    /**
     * Selects from {@code eligible} (children of the node in declared order).
     *
     * @throws IllegalArgumentException when the node has no pick configuration
     */
    public PickResult selectPick(HierarchyNode node, List<String> eligible, ParticipantState state) {
        PickConfig pick = node.getRules() != null ? node.getRules().getPick() : null;
        if (pick == null) {
            throw new IllegalArgumentException("Node " + node.getId() + " has no pick configuration");
        }
        List<String> prior = state.getAssignment(node.getId());
        if (prior != null) {
            prior.forEach(id -> state.accumulatePickAssigns(hierarchy.effectivePickAssigns(id)));
            return new PickResult(node.getId(), pick.getStrategy(), prior, 0, false, "restored", true);
        }

        List<String> candidates = eligible.stream()
                .filter(id -> evaluator.matchesAll(pick.getConditions(), hierarchy.effectivePickAssigns(id), state))
                .collect(Collectors.toList());
        int excluded = eligible.size() - candidates.size();
        int count = pick.getCount();
        PickStrategy strategy = pick.getStrategy();

        List<String> chosen;
        boolean relaxed = candidates.size() <= count;
        String outcome;
        if (relaxed) {
            chosen = candidates;
            outcome = candidates.size() < count
                    ? "only " + candidates.size() + " candidate(s) left, selected all"
                    : "all candidates selected";
            if (candidates.size() < count) {
                log.info("Pick relaxed | sessionId={} | nodeId={} | count={} | candidates={}", state.getSessionId(), node.getId(), count, candidates);
            }
        } else {
            switch (strategy) {
                case ROUND_ROBIN: {
                    long index = sequences.next(sequenceKey(node));
                    List<Integer> positions = Combinations.nth(candidates.size(), count, index);
                    chosen = positions.stream().map(candidates::get).collect(Collectors.toList());
                    outcome = "round robin combination " + Math.floorMod(index, Combinations.count(candidates.size(), count))
                            + " of " + Combinations.count(candidates.size(), count);
                    break;
                }
                case WEIGHTED_RANDOM: {
                    SplittableRandom rng = new SplittableRandom(Seeds.forNode(state.getSeed(), node.getId(), "pick"));
                    chosen = inDeclaredOrder(candidates,
                            Sampling.weightedWithoutReplacement(candidates, pick::weightOf, rng, count));
                    outcome = "weighted random draw";
                    break;
                }
                default: {
                    if (strategy == PickStrategy.UNKNOWN) {
                        log.warn("Unknown pick strategy, random will be used | nodeId={}", node.getId());
                    }
                    SplittableRandom rng = new SplittableRandom(Seeds.forNode(state.getSeed(), node.getId(), "pick"));
                    chosen = inDeclaredOrder(candidates, Sampling.shuffle(candidates, rng).subList(0, count));
                    outcome = "seeded random subset";
                    break;
                }
            }
        }

        List<String> effective = state.assignIfAbsent(node.getId(), chosen);
        effective.forEach(id -> state.accumulatePickAssigns(hierarchy.effectivePickAssigns(id)));
        String reason = "pick " + count + " of " + eligible.size() + " (" + strategy.toValue() + "): "
                + excluded + " excluded by conditions, " + outcome + " → " + effective;
        recorder.record(state.getSessionId(), AssignmentRecord.decision(node.getId(), node.getId(), effective,
                DecisionType.PICK, strategy.toValue(), reason));
        log.debug("Pick selected | sessionId={} | nodeId={} | chosen={} | excluded={}", state.getSessionId(), node.getId(), effective, excluded);
        return new PickResult(node.getId(), strategy, effective, excluded, relaxed, reason, false);
    }

    private static List<String> inDeclaredOrder(List<String> declared, List<String> subset) {
        Set<String> wanted = new HashSet<>(subset);
        List<String> out = new ArrayList<>(subset.size());
        for (String id : declared) {
            if (wanted.contains(id)) out.add(id);
        }
        return out;
    }
}

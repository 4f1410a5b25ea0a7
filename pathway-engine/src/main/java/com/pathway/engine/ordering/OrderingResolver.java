package com.pathway.engine.ordering;

import com.pathway.distribution.ClaimResult;
import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.CounterKind;
import com.pathway.distribution.DistributionStore;
import com.pathway.distribution.SequenceCounters;
import com.pathway.engine.random.Sampling;
import com.pathway.executioncontext.ParticipantState;
import com.pathway.executioncontext.Seeds;
import com.pathway.hierarchy.config.BalanceOn;
import com.pathway.hierarchy.config.OrderingMode;
import com.pathway.hierarchy.config.RulesConfig;
import com.pathway.hierarchy.tree.HierarchyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.stream.Collectors;

/**
 * Orders the working children of a container for one participant.
 * <ul>
 *   <li>{@code sequential}: declared order. Also used for missing and unrecognized modes.</li>
 *   <li>{@code randomized}: permutation seeded by (participant seed, node id).</li>
 *   <li>{@code balanced}: ascending by the {@code balance_on} counter, ties broken by a seeded permutation. The
 *   least-filled child is claimed in the same atomic store operation that read the counts.</li>
 *   <li>{@code weighted}: seeded weighted sampling without replacement; the first draw is claimed.</li>
 *   <li>{@code latin_square}: row {@code i mod N} of a cyclic Latin square, {@code i} dispensed by the node's
 *   sequence counter.</li>
 * </ul>
 * A participant's existing order for the node is reused as is (no counters touched), which keeps resumed and
 * retried sessions stable.
 */
public final class OrderingResolver {

    private static final Logger log = LoggerFactory.getLogger(OrderingResolver.class);

    private final DistributionStore store;
    private final SequenceCounters sequences;
    private final ConflictRetry retry;

    public OrderingResolver(DistributionStore store, SequenceCounters sequences, ConflictRetry retry) {
        this.store = Objects.requireNonNull(store, "store");
        this.sequences = Objects.requireNonNull(sequences, "sequences");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    /** Assignment key of the ordering decision at a node ({@code <id>#order} when the node also picks). */
    public static String assignmentKey(HierarchyNode node) {
        return node.getRules() != null && node.getRules().getPick() != null ? node.getId() + "#order" : node.getId();
    }

    /** Sequence counter key of a latin-square node. */
    public static String sequenceKey(HierarchyNode node) {
        return node.getId() + "#order";
    }

    /** Modes whose first child holds a started/active claim in the distribution store. */
    public static boolean claimsCounter(OrderingMode mode) {
        return mode == OrderingMode.BALANCED || mode == OrderingMode.WEIGHTED;
    }

    public static OrderingMode modeOf(HierarchyNode node) {
        OrderingMode mode = node.getRules() != null ? node.getRules().getOrderingMode() : OrderingMode.SEQUENTIAL;
        return mode == OrderingMode.UNKNOWN ? OrderingMode.SEQUENTIAL : mode;
    }

    /** Resolves with all declared children as the working set. */
    public OrderingResolution resolveOrder(HierarchyNode node, ParticipantState state) {
        List<String> children = node.getChildren().stream().map(HierarchyNode::getId).collect(Collectors.toList());
        return resolveOrder(node, children, state);
    }

    /**
     * Orders {@code workingSet} (children of {@code node} in declared order) for the participant and stores the
     * result under {@link #assignmentKey(HierarchyNode)}.
     */
    public OrderingResolution resolveOrder(HierarchyNode node, List<String> workingSet, ParticipantState state) {
        String key = assignmentKey(node);
        RulesConfig rules = node.getRules();
        OrderingMode configured = rules != null ? rules.getOrderingMode() : OrderingMode.SEQUENTIAL;
        OrderingMode mode = modeOf(node);
        List<String> prior = state.getAssignment(key);
        if (prior != null) {
            return new OrderingResolution(node.getId(), mode, prior, "restored", true);
        }
        if (configured == OrderingMode.UNKNOWN) {
            log.warn("Unknown ordering mode, sequential will be used | nodeId={} | ordering={}", node.getId(), rules.getOrdering());
        }
        OrderingResolution resolution;
        if (workingSet.isEmpty()) {
            resolution = new OrderingResolution(node.getId(), mode, List.of(), "no children", false);
        } else {
            switch (mode) {
                case RANDOMIZED:
                    resolution = randomized(node, workingSet, state);
                    break;
                case BALANCED:
                    resolution = balanced(node, workingSet, state);
                    break;
                case WEIGHTED:
                    resolution = weighted(node, workingSet, state);
                    break;
                case LATIN_SQUARE:
                    resolution = latinSquare(node, workingSet);
                    break;
                default:
                    resolution = new OrderingResolution(node.getId(), OrderingMode.SEQUENTIAL, workingSet,
                            configured == OrderingMode.UNKNOWN ? "unknown ordering '" + rules.getOrdering() + "', declared order" : "declared order",
                            false);
                    break;
            }
        }
        List<String> effective = state.assignIfAbsent(key, resolution.getOrder());
        if (!effective.equals(resolution.getOrder())) {
            // another request for this session stored its order first
            if (claimsCounter(resolution.getMode()) && !resolution.getOrder().isEmpty()) {
                store.release(node.getId(), resolution.getOrder().get(0));
            }
            log.info("Ordering already stored, keeping it | sessionId={} | nodeId={} | discarded={} | order={}",
                    state.getSessionId(), node.getId(), resolution.getOrder(), effective);
            return new OrderingResolution(node.getId(), mode, effective, "restored", true);
        }
        log.debug("Ordering resolved | sessionId={} | nodeId={} | mode={} | order={}",
                state.getSessionId(), node.getId(), resolution.getMode().toValue(), effective);
        return resolution;
    }

    private OrderingResolution randomized(HierarchyNode node, List<String> workingSet, ParticipantState state) {
        SplittableRandom rng = new SplittableRandom(Seeds.forNode(state.getSeed(), node.getId(), "order"));
        return new OrderingResolution(node.getId(), OrderingMode.RANDOMIZED, Sampling.shuffle(workingSet, rng),
                "seeded shuffle", false);
    }

    private OrderingResolution balanced(HierarchyNode node, List<String> workingSet, ParticipantState state) {
        SplittableRandom rng = new SplittableRandom(Seeds.forNode(state.getSeed(), node.getId(), "tiebreak"));
        List<String> tieOrder = Sampling.shuffle(workingSet, rng);
        CounterKind balanceOn = node.getRules().getBalanceOn() == BalanceOn.COMPLETED ? CounterKind.COMPLETED : CounterKind.STARTED;
        ClaimResult claim = retry.run("balanced " + node.getId(),
                () -> store.claimLeastFilled(node.getId(), tieOrder, balanceOn));
        Map<String, Long> observed = claim.getObserved();
        List<String> order = new ArrayList<>(tieOrder);
        order.sort(Comparator.comparingLong(observed::get));
        order.remove(claim.getChildId());
        order.add(0, claim.getChildId());
        String reason = "least-filled: counts " + claim.observedText() + " → picked " + claim.getChildId();
        return new OrderingResolution(node.getId(), OrderingMode.BALANCED, order, reason, false);
    }

    private OrderingResolution weighted(HierarchyNode node, List<String> workingSet, ParticipantState state) {
        Map<String, Double> weights = node.getRules().getWeights();
        SplittableRandom rng = new SplittableRandom(Seeds.forNode(state.getSeed(), node.getId(), "order"));
        List<String> order = Sampling.weightedWithoutReplacement(workingSet,
                id -> weights.getOrDefault(id, 1.0), rng, workingSet.size());
        retry.run("weighted " + node.getId(), () -> {
            store.claim(node.getId(), order.get(0));
            return null;
        });
        String weightText = workingSet.stream()
                .map(id -> id + ":" + formatWeight(weights.getOrDefault(id, 1.0)))
                .collect(Collectors.joining(",", "{", "}"));
        return new OrderingResolution(node.getId(), OrderingMode.WEIGHTED, order,
                "weighted draw " + weightText + " → " + order.get(0), false);
    }

    private OrderingResolution latinSquare(HierarchyNode node, List<String> workingSet) {
        int n = workingSet.size();
        long index = sequences.next(sequenceKey(node));
        int row = (int) Math.floorMod(index, (long) n);
        List<String> order = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            order.add(workingSet.get((row + k) % n));
        }
        return new OrderingResolution(node.getId(), OrderingMode.LATIN_SQUARE, order,
                "latin square row " + row + " of " + n + " (participant index " + index + ")", false);
    }

    private static String formatWeight(double w) {
        return w == Math.rint(w) ? String.valueOf((long) w) : String.valueOf(w);
    }
}

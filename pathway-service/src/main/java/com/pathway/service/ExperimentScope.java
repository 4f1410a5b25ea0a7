package com.pathway.service;

import com.pathway.config.PathwayConfig;
import com.pathway.distribution.ConflictRetry;
import com.pathway.distribution.DistributionStore;
import com.pathway.distribution.InMemoryDistributionStore;
import com.pathway.distribution.InMemorySequenceCounters;
import com.pathway.distribution.RedisDistributionStore;
import com.pathway.distribution.RedisSequenceCounters;
import com.pathway.distribution.SequenceCounters;
import com.pathway.engine.PathResolver;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.rules.RuleEvaluator;
import com.pathway.simulator.PathSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Everything owned by one published experiment version: its hierarchy, distribution counters, sequence counters,
 * path resolver and simulator. Closing the scope tears down the stores.
 */
public final class ExperimentScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExperimentScope.class);

    private final Hierarchy hierarchy;
    private final RuleEvaluator evaluator;
    private final DistributionStore store;
    private final SequenceCounters sequences;
    private final PathResolver resolver;
    private final PathSimulator simulator;

    ExperimentScope(Hierarchy hierarchy, RuleEvaluator evaluator, DistributionStore store, SequenceCounters sequences,
                    AssignmentRecorder recorder, PathwayConfig config) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.store = Objects.requireNonNull(store, "store");
        this.sequences = Objects.requireNonNull(sequences, "sequences");
        this.resolver = PathResolver.builder(hierarchy)
                .evaluator(evaluator)
                .store(store)
                .sequences(sequences)
                .recorder(recorder)
                .retry(new ConflictRetry(config.getConflictMaxRetries()))
                .quotaWait(config.getQuotaWaitTimeoutMs(), config.getQuotaWaitInitialBackoffMs(),
                        config.getQuotaWaitMaxBackoffMs())
                .maxRedirects(config.getMaxRedirects())
                .build();
        this.simulator = new PathSimulator(hierarchy, evaluator, config);
    }

    /**
     * Opens the stores selected by {@link PathwayConfig#getDistributionStore()}; Redis keys are prefixed per
     * experiment version.
     */
    static ExperimentScope open(Hierarchy hierarchy, RuleEvaluator evaluator, AssignmentRecorder recorder,
                                PathwayConfig config) {
        DistributionStore store;
        SequenceCounters sequences;
        if (config.getDistributionStore() == PathwayConfig.StoreBackend.REDIS) {
            String prefix = config.getKeyPrefix(hierarchy.getExperimentId(), hierarchy.getVersion());
            store = new RedisDistributionStore(config.getCacheHost(), config.getCachePort(), prefix);
            sequences = new RedisSequenceCounters(config.getCacheHost(), config.getCachePort(), prefix);
            log.info("Experiment scope opened | experimentId={} | version={} | store=redis | prefix={}",
                    hierarchy.getExperimentId(), hierarchy.getVersion(), prefix);
        } else {
            store = new InMemoryDistributionStore();
            sequences = new InMemorySequenceCounters();
            log.info("Experiment scope opened | experimentId={} | version={} | store=memory",
                    hierarchy.getExperimentId(), hierarchy.getVersion());
        }
        return new ExperimentScope(hierarchy, evaluator, store, sequences, recorder, config);
    }

    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    public RuleEvaluator getEvaluator() {
        return evaluator;
    }

    public DistributionStore getStore() {
        return store;
    }

    public SequenceCounters getSequences() {
        return sequences;
    }

    public PathResolver getResolver() {
        return resolver;
    }

    public PathSimulator getSimulator() {
        return simulator;
    }

    @Override
    public void close() {
        try {
            store.close();
        } finally {
            sequences.close();
        }
        log.info("Experiment scope closed | experimentId={} | version={}", hierarchy.getExperimentId(), hierarchy.getVersion());
    }
}

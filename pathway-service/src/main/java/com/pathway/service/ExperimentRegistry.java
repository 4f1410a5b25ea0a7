package com.pathway.service;

import com.pathway.config.PathwayConfig;
import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.config.ExperimentDefinition;
import com.pathway.hierarchy.tree.Hierarchy;
import com.pathway.hierarchy.validation.HierarchyValidator;
import com.pathway.hierarchy.validation.ValidationResult;
import com.pathway.ledger.AssignmentLedgerStore;
import com.pathway.ledger.AssignmentRecorder;
import com.pathway.ledger.InMemoryAssignmentLedgerStore;
import com.pathway.ledger.NoOpAssignmentLedgerStore;
import com.pathway.ledger.store.JdbcAssignmentLedgerStore;
import com.pathway.rules.RuleEvaluationPolicy;
import com.pathway.rules.RuleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Published experiments by id. One version is live per experiment; publishing a new version replaces the scope
 * and closes the old one. The assignment ledger is shared by all experiments.
 */
public final class ExperimentRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRegistry.class);

    private final PathwayConfig config;
    private final RuleEvaluator evaluator;
    private final AssignmentRecorder recorder;
    private final Map<String, ExperimentScope> scopes = new ConcurrentHashMap<>();

    public ExperimentRegistry(PathwayConfig config) {
        this(config, new AssignmentRecorder(createLedgerStore(config)));
    }

    public ExperimentRegistry(PathwayConfig config, AssignmentRecorder recorder) {
        this.config = Objects.requireNonNull(config, "config");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.evaluator = new RuleEvaluator(RuleEvaluationPolicy.fromFailOpen(config.isRuleFailOpen()));
    }

    /**
     * Ledger store per {@link PathwayConfig#getLedger()}. A JDBC store that cannot be initialized falls back to the
     * no-op store so routing keeps working without history.
     */
    static AssignmentLedgerStore createLedgerStore(PathwayConfig config) {
        switch (config.getLedger()) {
            case NONE:
                return new NoOpAssignmentLedgerStore();
            case JDBC:
                try {
                    JdbcAssignmentLedgerStore jdbcStore = new JdbcAssignmentLedgerStore(config);
                    jdbcStore.ensureSchema();
                    return jdbcStore;
                } catch (Exception e) {
                    log.warn("Assignment ledger using no-op store: could not create or init JDBC store ({}). Routing continues.",
                            e.getMessage());
                    return new NoOpAssignmentLedgerStore();
                }
            case MEMORY:
            default:
                return new InMemoryAssignmentLedgerStore();
        }
    }

    /**
     * Validates and registers an experiment version.
     *
     * @throws ConfigurationException with every validation error when the definition is invalid
     */
    public ExperimentScope publish(ExperimentDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        ValidationResult validation = validate(definition);
        if (!validation.isValid()) {
            log.warn("Experiment rejected | experimentId={} | errors={}", definition.getExperimentId(), validation.getErrors());
            throw new ConfigurationException(validation.getErrors());
        }
        for (String warning : validation.getWarnings()) {
            log.warn("Experiment warning | experimentId={} | {}", definition.getExperimentId(), warning);
        }
        Hierarchy hierarchy = Hierarchy.from(definition);
        ExperimentScope scope = ExperimentScope.open(hierarchy, evaluator, recorder, config);
        ExperimentScope previous = scopes.put(hierarchy.getExperimentId(), scope);
        if (previous != null) {
            log.info("Experiment replaced | experimentId={} | oldVersion={} | newVersion={}",
                    hierarchy.getExperimentId(), previous.getHierarchy().getVersion(), hierarchy.getVersion());
            previous.close();
        }
        log.info("Experiment published | experimentId={} | version={} | nodes={}",
                hierarchy.getExperimentId(), hierarchy.getVersion(), hierarchy.size());
        return scope;
    }

    public ValidationResult validate(ExperimentDefinition definition) {
        return new HierarchyValidator(evaluator.syntaxCheck()).validate(definition);
    }

    /** @throws UnknownExperimentException when the experiment is not published */
    public ExperimentScope get(String experimentId) {
        ExperimentScope scope = experimentId != null ? scopes.get(experimentId) : null;
        if (scope == null) throw new UnknownExperimentException(experimentId);
        return scope;
    }

    public boolean contains(String experimentId) {
        return experimentId != null && scopes.containsKey(experimentId);
    }

    /** Closes and forgets an experiment; returns false when it was not published. */
    public boolean unpublish(String experimentId) {
        ExperimentScope scope = experimentId != null ? scopes.remove(experimentId) : null;
        if (scope == null) return false;
        scope.close();
        return true;
    }

    public RuleEvaluator getEvaluator() {
        return evaluator;
    }

    public AssignmentRecorder getRecorder() {
        return recorder;
    }

    @Override
    public void close() {
        List<ExperimentScope> open = new ArrayList<>(scopes.values());
        scopes.clear();
        for (ExperimentScope scope : open) {
            try {
                scope.close();
            } catch (RuntimeException e) {
                log.warn("Experiment scope close failed | experimentId={} | error={}",
                        scope.getHierarchy().getExperimentId(), e.getMessage(), e);
            }
        }
    }
}

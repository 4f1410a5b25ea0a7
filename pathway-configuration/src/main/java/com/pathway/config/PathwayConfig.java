package com.pathway.config;

import java.util.Map;
import java.util.Objects;

/**
 * Engine configuration loaded from environment variables.
 * <p>
 * Distribution store: PATHWAY_DISTRIBUTION_STORE (memory|redis), PATHWAY_CACHE_HOST, PATHWAY_CACHE_PORT,
 * PATHWAY_KEY_PREFIX. Assignment ledger: PATHWAY_LEDGER (memory|jdbc|none), PATHWAY_DB_HOST, PATHWAY_DB_PORT,
 * PATHWAY_DB_NAME, PATHWAY_DB_USER, PATHWAY_DB_PASSWORD.
 * <p>
 * Unparseable values fall back to the defaults.
 */
public final class PathwayConfig {

    private static final String ENV_DISTRIBUTION_STORE = "PATHWAY_DISTRIBUTION_STORE";
    private static final String ENV_CACHE_HOST = "PATHWAY_CACHE_HOST";
    private static final String ENV_CACHE_PORT = "PATHWAY_CACHE_PORT";
    private static final String ENV_KEY_PREFIX = "PATHWAY_KEY_PREFIX";
    private static final String ENV_LEDGER = "PATHWAY_LEDGER";
    private static final String ENV_DB_HOST = "PATHWAY_DB_HOST";
    private static final String ENV_DB_PORT = "PATHWAY_DB_PORT";
    private static final String ENV_DB_NAME = "PATHWAY_DB_NAME";
    private static final String ENV_DB_USER = "PATHWAY_DB_USER";
    private static final String ENV_DB_PASSWORD = "PATHWAY_DB_PASSWORD";
    private static final String ENV_RULE_FAILURE_POLICY = "PATHWAY_RULE_FAILURE_POLICY";
    private static final String ENV_QUOTA_WAIT_TIMEOUT_MS = "PATHWAY_QUOTA_WAIT_TIMEOUT_MS";
    private static final String ENV_QUOTA_WAIT_INITIAL_BACKOFF_MS = "PATHWAY_QUOTA_WAIT_INITIAL_BACKOFF_MS";
    private static final String ENV_QUOTA_WAIT_MAX_BACKOFF_MS = "PATHWAY_QUOTA_WAIT_MAX_BACKOFF_MS";
    private static final String ENV_CONFLICT_MAX_RETRIES = "PATHWAY_CONFLICT_MAX_RETRIES";
    private static final String ENV_MAX_REDIRECTS = "PATHWAY_MAX_REDIRECTS";
    private static final String ENV_SIMULATION_MAX_PARTICIPANTS = "PATHWAY_SIMULATION_MAX_PARTICIPANTS";
    private static final String ENV_SIMULATION_PARALLELISM = "PATHWAY_SIMULATION_PARALLELISM";
    private static final String ENV_EXPERIMENT_DIR = "PATHWAY_EXPERIMENT_DIR";

    private static final String EXPERIMENT_PLACEHOLDER = "<experiment>";
    private static final String DEFAULT_KEY_PREFIX = "<experiment>:pathway:distribution";
    private static final String DEFAULT_DB_NAME = "pathway";
    private static final String DEFAULT_EXPERIMENT_DIR = "experiments";
    private static final long DEFAULT_QUOTA_WAIT_TIMEOUT_MS = 30_000L;
    private static final long DEFAULT_QUOTA_WAIT_INITIAL_BACKOFF_MS = 50L;
    private static final long DEFAULT_QUOTA_WAIT_MAX_BACKOFF_MS = 2_000L;
    private static final int DEFAULT_CONFLICT_MAX_RETRIES = 5;
    private static final int DEFAULT_MAX_REDIRECTS = 8;
    private static final int DEFAULT_SIMULATION_MAX_PARTICIPANTS = 100_000;

    /** Backing store for distribution and sequence counters. */
    public enum StoreBackend {
        MEMORY,
        REDIS;

        static StoreBackend parse(String value, StoreBackend defaultValue) {
            if (value == null || value.isBlank()) return defaultValue;
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return defaultValue;
            }
        }
    }

    /** Backing store for assignment records. */
    public enum LedgerBackend {
        MEMORY,
        JDBC,
        NONE;

        static LedgerBackend parse(String value, LedgerBackend defaultValue) {
            if (value == null || value.isBlank()) return defaultValue;
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return defaultValue;
            }
        }
    }

    private final StoreBackend distributionStore;
    private final String cacheHost;
    private final int cachePort;
    private final String keyPrefix;
    private final LedgerBackend ledger;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final boolean ruleFailOpen;
    private final long quotaWaitTimeoutMs;
    private final long quotaWaitInitialBackoffMs;
    private final long quotaWaitMaxBackoffMs;
    private final int conflictMaxRetries;
    private final int maxRedirects;
    private final int simulationMaxParticipants;
    private final int simulationParallelism;
    private final String experimentDir;

    private PathwayConfig(Builder b) {
        this.distributionStore = b.distributionStore;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.keyPrefix = b.keyPrefix;
        this.ledger = b.ledger;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : "pathway";
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.ruleFailOpen = b.ruleFailOpen;
        this.quotaWaitTimeoutMs = Math.max(0L, b.quotaWaitTimeoutMs);
        this.quotaWaitInitialBackoffMs = Math.max(1L, b.quotaWaitInitialBackoffMs);
        this.quotaWaitMaxBackoffMs = Math.max(this.quotaWaitInitialBackoffMs, b.quotaWaitMaxBackoffMs);
        this.conflictMaxRetries = Math.max(0, b.conflictMaxRetries);
        this.maxRedirects = Math.max(1, b.maxRedirects);
        this.simulationMaxParticipants = Math.max(1, b.simulationMaxParticipants);
        this.simulationParallelism = b.simulationParallelism > 0
                ? b.simulationParallelism
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        this.experimentDir = b.experimentDir;
    }

    public static PathwayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading from the given map (tests, embedded use). */
    public static PathwayConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .distributionStore(StoreBackend.parse(env.get(ENV_DISTRIBUTION_STORE), StoreBackend.MEMORY))
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.get(ENV_CACHE_PORT), 6379))
                .keyPrefix(getEnv(env, ENV_KEY_PREFIX, DEFAULT_KEY_PREFIX))
                .ledger(LedgerBackend.parse(env.get(ENV_LEDGER), LedgerBackend.MEMORY))
                .dbHost(getEnv(env, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(env.get(ENV_DB_PORT), 5432))
                .dbName(getEnv(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(env, ENV_DB_USER, "pathway"))
                .dbPassword(getEnv(env, ENV_DB_PASSWORD, ""))
                .ruleFailOpen(!"fail_closed".equalsIgnoreCase(getEnv(env, ENV_RULE_FAILURE_POLICY, "fail_open")))
                .quotaWaitTimeoutMs(parseLong(env.get(ENV_QUOTA_WAIT_TIMEOUT_MS), DEFAULT_QUOTA_WAIT_TIMEOUT_MS))
                .quotaWaitInitialBackoffMs(parseLong(env.get(ENV_QUOTA_WAIT_INITIAL_BACKOFF_MS), DEFAULT_QUOTA_WAIT_INITIAL_BACKOFF_MS))
                .quotaWaitMaxBackoffMs(parseLong(env.get(ENV_QUOTA_WAIT_MAX_BACKOFF_MS), DEFAULT_QUOTA_WAIT_MAX_BACKOFF_MS))
                .conflictMaxRetries(parseInt(env.get(ENV_CONFLICT_MAX_RETRIES), DEFAULT_CONFLICT_MAX_RETRIES))
                .maxRedirects(parseInt(env.get(ENV_MAX_REDIRECTS), DEFAULT_MAX_REDIRECTS))
                .simulationMaxParticipants(parseInt(env.get(ENV_SIMULATION_MAX_PARTICIPANTS), DEFAULT_SIMULATION_MAX_PARTICIPANTS))
                .simulationParallelism(parseInt(env.get(ENV_SIMULATION_PARALLELISM), 0))
                .experimentDir(getEnv(env, ENV_EXPERIMENT_DIR, DEFAULT_EXPERIMENT_DIR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Distribution key prefix scoped to one experiment version. Default base is {@code <experiment>:pathway:distribution};
     * returns e.g. {@code reading-study@3:pathway:distribution}.
     */
    public String getKeyPrefix(String experimentId, String version) {
        String scope = experimentId + (version != null && !version.isBlank() ? "@" + version.trim() : "");
        if (keyPrefix.contains(EXPERIMENT_PLACEHOLDER)) {
            return keyPrefix.replace(EXPERIMENT_PLACEHOLDER, scope);
        }
        return scope + ":" + keyPrefix;
    }

    public StoreBackend getDistributionStore() {
        return distributionStore;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Unscoped key prefix template; see {@link #getKeyPrefix(String, String)}. */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    public LedgerBackend getLedger() {
        return ledger;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** JDBC URL for the assignment ledger database. */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    /** True when a malformed visibility rule evaluates to visible (PATHWAY_RULE_FAILURE_POLICY=fail_open, the default). */
    public boolean isRuleFailOpen() {
        return ruleFailOpen;
    }

    /** Upper bound on one wait_for_slot suspension. 0 = never block, report WAITING immediately. */
    public long getQuotaWaitTimeoutMs() {
        return quotaWaitTimeoutMs;
    }

    public long getQuotaWaitInitialBackoffMs() {
        return quotaWaitInitialBackoffMs;
    }

    public long getQuotaWaitMaxBackoffMs() {
        return quotaWaitMaxBackoffMs;
    }

    /** Re-read-and-redecide attempts after a lost counter race before the conflict escalates. */
    public int getConflictMaxRetries() {
        return conflictMaxRetries;
    }

    /** Quota redirects followed for one node before the participant is considered blocked. */
    public int getMaxRedirects() {
        return maxRedirects;
    }

    public int getSimulationMaxParticipants() {
        return simulationMaxParticipants;
    }

    public int getSimulationParallelism() {
        return simulationParallelism;
    }

    /** Directory with local experiment definition files. Default {@code experiments}. */
    public String getExperimentDir() {
        return experimentDir;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private StoreBackend distributionStore = StoreBackend.MEMORY;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private String keyPrefix = DEFAULT_KEY_PREFIX;
        private LedgerBackend ledger = LedgerBackend.MEMORY;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = "pathway";
        private String dbPassword = "";
        private boolean ruleFailOpen = true;
        private long quotaWaitTimeoutMs = DEFAULT_QUOTA_WAIT_TIMEOUT_MS;
        private long quotaWaitInitialBackoffMs = DEFAULT_QUOTA_WAIT_INITIAL_BACKOFF_MS;
        private long quotaWaitMaxBackoffMs = DEFAULT_QUOTA_WAIT_MAX_BACKOFF_MS;
        private int conflictMaxRetries = DEFAULT_CONFLICT_MAX_RETRIES;
        private int maxRedirects = DEFAULT_MAX_REDIRECTS;
        private int simulationMaxParticipants = DEFAULT_SIMULATION_MAX_PARTICIPANTS;
        private int simulationParallelism;
        private String experimentDir = DEFAULT_EXPERIMENT_DIR;

        public Builder distributionStore(StoreBackend distributionStore) {
            this.distributionStore = Objects.requireNonNull(distributionStore, "distributionStore");
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;
            return this;
        }

        public Builder ledger(LedgerBackend ledger) {
            this.ledger = Objects.requireNonNull(ledger, "ledger");
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder ruleFailOpen(boolean ruleFailOpen) {
            this.ruleFailOpen = ruleFailOpen;
            return this;
        }

        public Builder quotaWaitTimeoutMs(long quotaWaitTimeoutMs) {
            this.quotaWaitTimeoutMs = quotaWaitTimeoutMs;
            return this;
        }

        public Builder quotaWaitInitialBackoffMs(long quotaWaitInitialBackoffMs) {
            this.quotaWaitInitialBackoffMs = quotaWaitInitialBackoffMs;
            return this;
        }

        public Builder quotaWaitMaxBackoffMs(long quotaWaitMaxBackoffMs) {
            this.quotaWaitMaxBackoffMs = quotaWaitMaxBackoffMs;
            return this;
        }

        public Builder conflictMaxRetries(int conflictMaxRetries) {
            this.conflictMaxRetries = conflictMaxRetries;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public Builder simulationMaxParticipants(int simulationMaxParticipants) {
            this.simulationMaxParticipants = simulationMaxParticipants;
            return this;
        }

        /** Worker threads for simulation; 0 or less = available processors. */
        public Builder simulationParallelism(int simulationParallelism) {
            this.simulationParallelism = simulationParallelism;
            return this;
        }

        public Builder experimentDir(String experimentDir) {
            this.experimentDir = experimentDir != null ? experimentDir : DEFAULT_EXPERIMENT_DIR;
            return this;
        }

        public PathwayConfig build() {
            return new PathwayConfig(this);
        }
    }
}

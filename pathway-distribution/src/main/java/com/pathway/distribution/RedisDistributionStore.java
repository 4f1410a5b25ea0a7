package com.pathway.distribution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Redis-backed {@link DistributionStore} shared by every worker serving an experiment version.
 * <p>
 * Layout: one hash per level at {@code <prefix>:level:<levelId>} with fields {@code <childId>:started},
 * {@code <childId>:completed} and {@code <childId>:active}; the set {@code <prefix>:levels} lists touched levels.
 * Read-then-write operations run under WATCH/MULTI/EXEC; when another writer touched the hash in between, EXEC
 * aborts and {@link ConcurrencyConflictException} is thrown with nothing written.
 * <p>
 * Listeners only see decrements made through this instance; waiters in other processes rely on polling.
 */
public final class RedisDistributionStore implements DistributionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDistributionStore.class);

    private final JedisPool pool;
    private final boolean ownsPool;
    private final String keyPrefix;
    private final List<CounterListener> listeners = new CopyOnWriteArrayList<>();

    public RedisDistributionStore(String host, int port, String keyPrefix) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(host, "host"), port), keyPrefix, true);
        log.debug("RedisDistributionStore connected to {}:{} | prefix={}", host, port, keyPrefix);
    }

    public RedisDistributionStore(JedisPool pool, String keyPrefix) {
        this(pool, keyPrefix, false);
    }

    private RedisDistributionStore(JedisPool pool, String keyPrefix, boolean ownsPool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.ownsPool = ownsPool;
    }

    String levelKey(String levelId) {
        return keyPrefix + ":level:" + levelId;
    }

    String levelsKey() {
        return keyPrefix + ":levels";
    }

    static String field(String childId, CounterKind kind) {
        return childId + ":" + kind.toValue();
    }

    /** Decodes a level hash; malformed numbers read as 0, unknown fields are ignored. */
    static Map<String, DistributionCounts> parseLevel(Map<String, String> hash) {
        Map<String, Map<CounterKind, Long>> raw = new TreeMap<>();
        if (hash != null) {
            for (Map.Entry<String, String> e : hash.entrySet()) {
                int sep = e.getKey().lastIndexOf(':');
                if (sep <= 0) continue;
                String childId = e.getKey().substring(0, sep);
                String suffix = e.getKey().substring(sep + 1);
                CounterKind kind = null;
                for (CounterKind k : CounterKind.values()) {
                    if (k.toValue().equals(suffix)) kind = k;
                }
                if (kind == null) continue;
                raw.computeIfAbsent(childId, id -> new EnumMap<>(CounterKind.class)).put(kind, parseLong(e.getValue()));
            }
        }
        Map<String, DistributionCounts> out = new LinkedHashMap<>();
        raw.forEach((childId, values) -> out.put(childId, new DistributionCounts(
                values.getOrDefault(CounterKind.STARTED, 0L),
                values.getOrDefault(CounterKind.COMPLETED, 0L),
                values.getOrDefault(CounterKind.ACTIVE, 0L))));
        return out;
    }

    private static long parseLong(String v) {
        if (v == null || v.isBlank()) return 0L;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    @Override
    public DistributionCounts counts(String levelId, String childId) {
        return snapshot(levelId).getOrDefault(childId, DistributionCounts.ZERO);
    }

    @Override
    public Map<String, DistributionCounts> snapshot(String levelId) {
        try (var jedis = pool.getResource()) {
            return Collections.unmodifiableMap(parseLevel(jedis.hgetAll(levelKey(levelId))));
        }
    }

    @Override
    public Map<String, Map<String, DistributionCounts>> snapshotAll() {
        Map<String, Map<String, DistributionCounts>> all = new TreeMap<>();
        try (var jedis = pool.getResource()) {
            for (String levelId : jedis.smembers(levelsKey())) {
                Map<String, DistributionCounts> level = parseLevel(jedis.hgetAll(levelKey(levelId)));
                if (!level.isEmpty()) all.put(levelId, level);
            }
        }
        return Collections.unmodifiableMap(all);
    }

    @Override
    public ClaimResult claimLeastFilled(String levelId, List<String> candidates, CounterKind balanceOn) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to claim at level " + levelId);
        }
        String key = levelKey(levelId);
        try (var jedis = pool.getResource()) {
            jedis.watch(key);
            Map<String, DistributionCounts> current = parseLevel(jedis.hgetAll(key));
            Map<String, Long> observed = new LinkedHashMap<>();
            String chosen = null;
            long min = Long.MAX_VALUE;
            for (String candidate : candidates) {
                long value = current.getOrDefault(candidate, DistributionCounts.ZERO).get(balanceOn);
                observed.put(candidate, value);
                if (value < min) {
                    min = value;
                    chosen = candidate;
                }
            }
            Transaction tx = jedis.multi();
            tx.hincrBy(key, field(chosen, CounterKind.STARTED), 1);
            tx.hincrBy(key, field(chosen, CounterKind.ACTIVE), 1);
            tx.sadd(levelsKey(), levelId);
            execOrConflict(tx, levelId, "claim");
            return new ClaimResult(chosen, observed);
        }
    }

    @Override
    public void claim(String levelId, String childId) {
        String key = levelKey(levelId);
        try (var jedis = pool.getResource()) {
            Transaction tx = jedis.multi();
            tx.hincrBy(key, field(childId, CounterKind.STARTED), 1);
            tx.hincrBy(key, field(childId, CounterKind.ACTIVE), 1);
            tx.sadd(levelsKey(), levelId);
            tx.exec();
        }
    }

    @Override
    public Admission tryAdmit(String levelId, String childId, CounterKind countOn, long limit) {
        String key = levelKey(levelId);
        try (var jedis = pool.getResource()) {
            jedis.watch(key);
            long current = parseLong(jedis.hget(key, field(childId, countOn)));
            if (current >= limit) {
                jedis.unwatch();
                return new Admission(false, current);
            }
            Transaction tx = jedis.multi();
            tx.hincrBy(key, field(childId, CounterKind.STARTED), 1);
            tx.hincrBy(key, field(childId, CounterKind.ACTIVE), 1);
            tx.sadd(levelsKey(), levelId);
            execOrConflict(tx, levelId, "admit");
            return new Admission(true, current);
        }
    }

    @Override
    public void complete(String levelId, String childId) {
        adjust(levelId, childId, CounterKind.COMPLETED, CounterKind.ACTIVE);
    }

    @Override
    public void release(String levelId, String childId) {
        adjust(levelId, childId, null, CounterKind.STARTED, CounterKind.ACTIVE);
    }

    /** Increments {@code up} (when set) and decrements each of {@code down} without going below zero. */
    private void adjust(String levelId, String childId, CounterKind up, CounterKind... down) {
        String key = levelKey(levelId);
        try (var jedis = pool.getResource()) {
            jedis.watch(key);
            Map<CounterKind, Long> current = readChild(jedis, key, childId);
            Transaction tx = jedis.multi();
            if (up != null) tx.hincrBy(key, field(childId, up), 1);
            for (CounterKind kind : down) {
                if (current.getOrDefault(kind, 0L) > 0) tx.hincrBy(key, field(childId, kind), -1);
            }
            tx.sadd(levelsKey(), levelId);
            execOrConflict(tx, levelId, "adjust");
        }
        notifyReleased(levelId, childId);
    }

    private Map<CounterKind, Long> readChild(Jedis jedis, String key, String childId) {
        Map<CounterKind, Long> values = new EnumMap<>(CounterKind.class);
        for (CounterKind kind : CounterKind.values()) {
            values.put(kind, parseLong(jedis.hget(key, field(childId, kind))));
        }
        return values;
    }

    private static void execOrConflict(Transaction tx, String levelId, String operation) {
        List<Object> result = tx.exec();
        if (result == null) {
            throw new ConcurrencyConflictException(levelId, "Concurrent update aborted " + operation + " at level " + levelId);
        }
    }

    @Override
    public void reset(String levelId) {
        try (var jedis = pool.getResource()) {
            jedis.del(levelKey(levelId));
            jedis.srem(levelsKey(), levelId);
        }
        log.info("Distribution counters reset | levelId={} | prefix={}", levelId, keyPrefix);
    }

    @Override
    public void resetChild(String levelId, String childId) {
        try (var jedis = pool.getResource()) {
            jedis.hdel(levelKey(levelId), field(childId, CounterKind.STARTED),
                    field(childId, CounterKind.COMPLETED), field(childId, CounterKind.ACTIVE));
        }
        log.info("Distribution counters reset | levelId={} | childId={} | prefix={}", levelId, childId, keyPrefix);
    }

    @Override
    public void resetAll() {
        try (var jedis = pool.getResource()) {
            for (String levelId : jedis.smembers(levelsKey())) {
                jedis.del(levelKey(levelId));
            }
            jedis.del(levelsKey());
        }
        log.info("Distribution counters reset | levelId=* | prefix={}", keyPrefix);
    }

    @Override
    public Runnable addListener(CounterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> listeners.remove(listener);
    }

    private void notifyReleased(String levelId, String childId) {
        for (CounterListener listener : listeners) {
            try {
                listener.countersReleased(levelId, childId);
            } catch (RuntimeException e) {
                log.warn("Counter listener failed | levelId={} | childId={}", levelId, childId, e);
            }
        }
    }

    @Override
    public void close() {
        if (ownsPool) pool.close();
    }
}

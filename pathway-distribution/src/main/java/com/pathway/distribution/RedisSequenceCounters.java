package com.pathway.distribution;

import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Response;
import redis.clients.jedis.Transaction;

import java.util.Objects;

/**
 * {@link SequenceCounters} on Redis INCR, keys {@code <prefix>:seq:<key>}. Every key that has been advanced is
 * recorded in the set {@code <prefix>:seqs} so a full reset never scans the keyspace.
 */
public final class RedisSequenceCounters implements SequenceCounters {

    private final JedisPool pool;
    private final boolean ownsPool;
    private final String keyPrefix;

    public RedisSequenceCounters(String host, int port, String keyPrefix) {
        this(new JedisPool(new JedisPoolConfig(), Objects.requireNonNull(host, "host"), port), keyPrefix, true);
    }

    public RedisSequenceCounters(JedisPool pool, String keyPrefix) {
        this(pool, keyPrefix, false);
    }

    private RedisSequenceCounters(JedisPool pool, String keyPrefix, boolean ownsPool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        this.ownsPool = ownsPool;
    }

    String sequenceKey(String key) {
        return keyPrefix + ":seq:" + key;
    }

    String sequencesKey() {
        return keyPrefix + ":seqs";
    }

    @Override
    public long next(String key) {
        try (var jedis = pool.getResource()) {
            Transaction tx = jedis.multi();
            Response<Long> value = tx.incr(sequenceKey(key));
            tx.sadd(sequencesKey(), key);
            tx.exec();
            return value.get() - 1;
        }
    }

    @Override
    public long current(String key) {
        try (var jedis = pool.getResource()) {
            String v = jedis.get(sequenceKey(key));
            if (v == null || v.isBlank()) return 0L;
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
    }

    @Override
    public void reset(String key) {
        try (var jedis = pool.getResource()) {
            jedis.del(sequenceKey(key));
            jedis.srem(sequencesKey(), key);
        }
    }

    @Override
    public void resetAll() {
        try (var jedis = pool.getResource()) {
            for (String key : jedis.smembers(sequencesKey())) {
                jedis.del(sequenceKey(key));
            }
            jedis.del(sequencesKey());
        }
    }

    @Override
    public void close() {
        if (ownsPool) pool.close();
    }
}

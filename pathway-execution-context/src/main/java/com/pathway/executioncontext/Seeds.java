package com.pathway.executioncontext;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic seed derivation. A participant's seed comes from the session id; per-node seeds mix the
 * participant seed with the node id so every container gets an independent, reproducible stream.
 */
public final class Seeds {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private Seeds() {
    }

    /** Stable 64-bit seed for a session id (FNV-1a over UTF-8 bytes, then mixed). */
    public static long fromSessionId(String sessionId) {
        return mix(fnv1a(sessionId != null ? sessionId : ""));
    }

    /** Seed for one decision at a node: {@code hash(participantSeed, nodeId)}. */
    public static long forNode(long participantSeed, String nodeId) {
        return mix(participantSeed ^ fnv1a(nodeId != null ? nodeId : ""));
    }

    /** Seed for a named decision at a node (e.g. {@code "pick"} vs {@code "order"} at the same container). */
    public static long forNode(long participantSeed, String nodeId, String purpose) {
        return forNode(mix(participantSeed + fnv1a(purpose != null ? purpose : "")), nodeId);
    }

    static long fnv1a(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    /** SplitMix64 finalizer. */
    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}

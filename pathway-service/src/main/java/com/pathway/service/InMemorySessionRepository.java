package com.pathway.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Sessions in a map; lost on restart. */
public final class InMemorySessionRepository implements SessionRepository {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Session putIfAbsent(Session session) {
        Session existing = sessions.putIfAbsent(session.getSessionId(), session);
        return existing != null ? existing : session;
    }

    @Override
    public Optional<Session> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void remove(String sessionId) {
        if (sessionId != null) sessions.remove(sessionId);
    }

    @Override
    public int removeExperiment(String experimentId) {
        int before = sessions.size();
        sessions.values().removeIf(s -> s.getExperimentId().equals(experimentId));
        return before - sessions.size();
    }
}

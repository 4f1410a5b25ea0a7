package com.pathway.service;

import java.util.Optional;

/**
 * Holds live participant sessions. The runtime may back this with its own session storage.
 */
public interface SessionRepository {

    /**
     * Stores the session unless one with the same id exists.
     *
     * @return the session now held under that id
     */
    Session putIfAbsent(Session session);

    Optional<Session> find(String sessionId);

    void remove(String sessionId);

    /** Removes every session of an experiment; returns how many were dropped. */
    int removeExperiment(String experimentId);
}

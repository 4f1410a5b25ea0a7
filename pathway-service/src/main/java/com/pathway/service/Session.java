package com.pathway.service;

import com.pathway.executioncontext.ParticipantState;

import java.util.Objects;

/**
 * A participant session bound to one published experiment. Operations on the same session are serialized by
 * {@link ExperimentService}.
 */
public final class Session {

    private final String experimentId;
    private final ParticipantState state;
    private volatile boolean abandoned;

    public Session(String experimentId, ParticipantState state) {
        this.experimentId = Objects.requireNonNull(experimentId, "experimentId");
        this.state = Objects.requireNonNull(state, "state");
    }

    public String getSessionId() {
        return state.getSessionId();
    }

    public String getExperimentId() {
        return experimentId;
    }

    public ParticipantState getState() {
        return state;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    void markAbandoned() {
        this.abandoned = true;
    }
}

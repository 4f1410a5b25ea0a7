package com.pathway.service;

public class UnknownSessionException extends RuntimeException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("Unknown session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

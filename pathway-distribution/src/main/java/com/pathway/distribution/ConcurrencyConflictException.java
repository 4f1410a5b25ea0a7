package com.pathway.distribution;

/**
 * An optimistic counter transaction lost a race with another writer. Callers re-read and re-decide,
 * see {@link ConflictRetry}.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final String levelId;

    public ConcurrencyConflictException(String levelId, String message) {
        super(message);
        this.levelId = levelId;
    }

    public String getLevelId() {
        return levelId;
    }
}

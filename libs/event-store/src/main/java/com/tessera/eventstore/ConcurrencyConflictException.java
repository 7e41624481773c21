package com.tessera.eventstore;

/** Thrown when an optimistic append finds the stream at a different version than expected. */
public class ConcurrencyConflictException extends RuntimeException {

    private final String subjectId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String subjectId, long expectedVersion, long actualVersion) {
        super(
                "Stream "
                        + subjectId
                        + " is at version "
                        + actualVersion
                        + ", expected "
                        + expectedVersion);
        this.subjectId = subjectId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String subjectId() {
        return subjectId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}

package com.tessera.threads;

/** A main conversation or a branch off one of its messages. */
public enum ThreadKind {
    MAIN("main"),
    BRANCH("branch");

    private final String value;

    ThreadKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

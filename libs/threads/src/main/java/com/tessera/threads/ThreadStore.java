package com.tessera.threads;

import java.util.List;
import java.util.Optional;

/** Persistence of threads and their messages. Threads reference each other by id only. */
public interface ThreadStore {

    /** @throws IllegalStateException when a thread with the same id exists */
    void insertThread(ChatThread thread);

    Optional<ChatThread> findThread(String threadId);

    /** Replaces {@code expected} with {@code updated} only if the stored thread still equals it. */
    boolean replaceThread(ChatThread expected, ChatThread updated);

    /** Direct branches of a thread, oldest first. */
    List<ChatThread> childrenOf(String parentThreadId);

    /** Messages of a thread in chain order. */
    List<ThreadMessage> messages(String threadId);

    Optional<ThreadMessage> findMessage(String messageId);

    /**
     * Appends {@code message} only if its {@code previousHash} is still the thread's terminal hash
     * (the seed hash for an empty thread) and its position is the next one.
     *
     * @return false when another message got there first
     */
    boolean appendIfTerminal(ThreadMessage message);
}

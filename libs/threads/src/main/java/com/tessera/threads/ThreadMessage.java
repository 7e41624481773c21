package com.tessera.threads;

import java.time.Instant;
import java.util.Objects;

/**
 * One link of a thread's hash chain.
 *
 * @param position 1-based position in the thread
 * @param previousHash hash of the prior message, or the thread's seed for the first one
 * @param hash {@code SHA-256(id + content + previousHash)}, hex encoded
 */
public record ThreadMessage(
        String id,
        String threadId,
        long position,
        MessageRole role,
        String content,
        String previousHash,
        String hash,
        Instant createdAt) {

    public ThreadMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(threadId, "threadId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(previousHash, "previousHash");
        Objects.requireNonNull(hash, "hash");
    }

    /** Same message with different content and the original hashes, as a tampered copy looks. */
    public ThreadMessage withContent(String newContent) {
        return new ThreadMessage(id, threadId, position, role, newContent, previousHash, hash, createdAt);
    }
}

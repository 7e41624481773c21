package com.tessera.threads;

import java.time.Instant;
import java.util.Objects;

/**
 * A node in a branch tree. Parents are referenced by id only; the tree is rebuilt by lookup.
 *
 * @param id thread id
 * @param userId owner
 * @param title display title; the purpose for branches
 * @param kind main thread or branch
 * @param parentThreadId parent for branches, null for main threads
 * @param branchedFromMessageId parent message a branch starts from
 * @param seedHash hash the first message chains from: empty for main threads, the branch point's
 *     hash for branches
 * @param status lifecycle status
 * @param contextSummary summary written when a branch is merged
 * @param createdAt creation time
 * @param updatedAt last status change
 * @param mergedAt merge time for merged branches
 */
public record ChatThread(
        String id,
        String userId,
        String title,
        ThreadKind kind,
        String parentThreadId,
        String branchedFromMessageId,
        String seedHash,
        ThreadStatus status,
        String contextSummary,
        Instant createdAt,
        Instant updatedAt,
        Instant mergedAt) {

    public ChatThread {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        seedHash = seedHash == null ? "" : seedHash;
        if (kind == ThreadKind.BRANCH && (parentThreadId == null || branchedFromMessageId == null)) {
            throw new IllegalArgumentException("branch " + id + " needs a parent thread and message");
        }
    }

    public boolean isActive() {
        return status == ThreadStatus.ACTIVE;
    }

    ChatThread archived(Instant at) {
        return new ChatThread(
                id, userId, title, kind, parentThreadId, branchedFromMessageId, seedHash,
                ThreadStatus.ARCHIVED, contextSummary, createdAt, at, mergedAt);
    }

    ChatThread merged(String summary, Instant at) {
        return new ChatThread(
                id, userId, title, kind, parentThreadId, branchedFromMessageId, seedHash,
                ThreadStatus.MERGED, summary, createdAt, at, at);
    }
}

package com.tessera.threads;

import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained conversation threads with branches and merges.
 *
 * <p>Each message stores {@code hash = SHA-256(id + content + previousHash)}. A main thread's
 * chain starts from the empty string. A branch starts a chain of its own, seeded with the hash of
 * the message it branches from, so it verifies without touching its parent. A merge appends one
 * summary message to the parent that embeds the branch's terminal hash.
 *
 * <p>Appends are compare-and-set on the thread's terminal hash and are retried when another
 * writer wins.
 */
public class ThreadLog {

    public static final int MAX_APPEND_ATTEMPTS = 64;
    public static final Duration DEFAULT_STREAM_IDLE_TIMEOUT = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(ThreadLog.class);

    private final ThreadStore store;
    private final Clock clock;
    private final Counter appended;
    private final Counter conflicts;

    public ThreadLog(ThreadStore store, Clock clock, MetricFactory metrics) {
        this.store = store;
        this.clock = clock;
        this.appended = metrics.counter("threads.messages.appended", "Messages appended to threads");
        this.conflicts =
                metrics.counter("threads.append.conflicts", "Appends retried after losing the terminal hash race");
    }

    public ChatThread createThread(String userId, String title) {
        Instant now = clock.instant();
        var thread =
                new ChatThread(
                        UUID.randomUUID().toString(), userId, title, ThreadKind.MAIN, null, null, "",
                        ThreadStatus.ACTIVE, null, now, now, null);
        store.insertThread(thread);
        log.info("Created thread {} for {}", thread.id(), userId);
        return thread;
    }

    /**
     * Appends a message at the end of the thread's chain.
     *
     * @throws UnknownThreadException when the thread does not exist
     * @throws ThreadConflictException when the thread is not active, or the append lost the race
     *     {@value #MAX_APPEND_ATTEMPTS} times
     */
    public ThreadMessage appendMessage(String threadId, String content, MessageRole role) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        for (int attempt = 1; attempt <= MAX_APPEND_ATTEMPTS; attempt++) {
            ChatThread thread = requireActive(threadId);
            List<ThreadMessage> chain = store.messages(threadId);
            String previousHash = chain.isEmpty() ? thread.seedHash() : chain.get(chain.size() - 1).hash();
            String id = UUID.randomUUID().toString();
            var message =
                    new ThreadMessage(
                            id, threadId, chain.size() + 1L, role, content, previousHash,
                            HashChain.hash(id, content, previousHash), clock.instant());
            if (store.appendIfTerminal(message)) {
                appended.increment();
                log.debug("Appended message {} to thread {} at position {}", id, threadId, message.position());
                return message;
            }
            conflicts.increment();
            log.debug("Terminal hash of thread {} moved, retrying append (attempt {})", threadId, attempt);
        }
        throw new ThreadConflictException(
                "Could not append to thread " + threadId + " after " + MAX_APPEND_ATTEMPTS + " attempts");
    }

    /**
     * Starts a branch off {@code fromMessageId}. The branch gets an empty chain seeded with that
     * message's hash.
     *
     * @throws IllegalArgumentException when the message is not in the parent thread
     */
    public ChatThread branch(String parentThreadId, String fromMessageId, String purpose) {
        ChatThread parent = requireThread(parentThreadId);
        ThreadMessage from =
                store.findMessage(fromMessageId)
                        .filter(m -> m.threadId().equals(parentThreadId))
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Message " + fromMessageId + " is not in thread " + parentThreadId));
        Instant now = clock.instant();
        var branch =
                new ChatThread(
                        UUID.randomUUID().toString(), parent.userId(), purpose, ThreadKind.BRANCH,
                        parentThreadId, fromMessageId, from.hash(), ThreadStatus.ACTIVE, null, now,
                        now, null);
        store.insertThread(branch);
        log.info("Branched thread {} off {} at message {}", branch.id(), parentThreadId, fromMessageId);
        return branch;
    }

    /**
     * Folds a branch back into its parent: appends a summary message carrying the branch's
     * terminal hash to the parent and marks the branch merged.
     *
     * @throws ThreadConflictException when the branch is not an active branch
     */
    public MergeResult merge(String branchId, String summary) {
        ChatThread branch = requireThread(branchId);
        if (branch.kind() != ThreadKind.BRANCH) {
            throw new ThreadConflictException("Thread " + branchId + " is not a branch");
        }
        if (!branch.isActive()) {
            throw new ThreadConflictException("Branch " + branchId + " is " + branch.status().value());
        }
        requireActive(branch.parentThreadId());

        List<ThreadMessage> chain = store.messages(branchId);
        String terminalHash = chain.isEmpty() ? branch.seedHash() : chain.get(chain.size() - 1).hash();
        ChatThread merged = branch.merged(summary, clock.instant());
        if (!store.replaceThread(branch, merged)) {
            throw new ThreadConflictException("Branch " + branchId + " changed while merging");
        }

        ThreadMessage summaryMessage;
        try {
            summaryMessage =
                    appendMessage(
                            branch.parentThreadId(), summaryContent(branchId, terminalHash, summary), MessageRole.SYSTEM);
        } catch (RuntimeException e) {
            if (!store.replaceThread(merged, branch)) {
                log.error("Branch {} left merged without a summary message", branchId);
            }
            throw e;
        }
        log.info(
                "Merged branch {} into {} with terminal hash {}", branchId, branch.parentThreadId(), terminalHash);
        return new MergeResult(merged, summaryMessage, terminalHash);
    }

    static String summaryContent(String branchId, String terminalHash, String summary) {
        return "[merged branch " + branchId + " @ " + terminalHash + "]\n" + (summary == null ? "" : summary);
    }

    public ChainVerification verify(String threadId) {
        ChatThread thread = requireThread(threadId);
        ChainVerification result = HashChain.verify(thread.seedHash(), store.messages(threadId));
        if (!result.valid()) {
            log.warn("Hash chain of thread {} broken at message {}", threadId, result.brokenAtMessageId());
        }
        return result;
    }

    /** Archives a thread; archiving twice is harmless. */
    public ChatThread archive(String threadId) {
        while (true) {
            ChatThread current = requireThread(threadId);
            if (current.status() == ThreadStatus.ARCHIVED) {
                return current;
            }
            ChatThread archived = current.archived(clock.instant());
            if (store.replaceThread(current, archived)) {
                log.info("Archived thread {}", threadId);
                return archived;
            }
        }
    }

    public List<ChatThread> listBranches(String threadId) {
        requireThread(threadId);
        return store.childrenOf(threadId);
    }

    /** The thread and all its descendants. */
    public BranchNode branchTree(String rootId) {
        return node(requireThread(rootId), new HashSet<>());
    }

    private BranchNode node(ChatThread thread, Set<String> visited) {
        visited.add(thread.id());
        List<BranchNode> children = new ArrayList<>();
        for (ChatThread child : store.childrenOf(thread.id())) {
            if (visited.contains(child.id())) {
                log.warn("Thread {} reachable twice in the branch tree, skipping", child.id());
                continue;
            }
            children.add(node(child, visited));
        }
        return new BranchNode(thread, children);
    }

    public List<ThreadMessage> history(String threadId) {
        requireThread(threadId);
        return store.messages(threadId);
    }

    public Optional<ChatThread> findThread(String threadId) {
        return store.findThread(threadId);
    }

    public ThreadMessage appendStreamed(String threadId, MessageRole role, ContentChannel channel) {
        return appendStreamed(threadId, role, channel, DEFAULT_STREAM_IDLE_TIMEOUT);
    }

    /**
     * Reads chunks until the producer completes, then appends the accumulated text as one message.
     * The channel is closed on every exit, which stops the producer.
     *
     * @throws StreamFailedException when the producer reports a failure, sends nothing for {@code
     *     idleTimeout}, or the caller is interrupted
     */
    public ThreadMessage appendStreamed(
            String threadId, MessageRole role, ContentChannel channel, Duration idleTimeout) {
        try {
            requireActive(threadId);
            StringBuilder content = new StringBuilder();
            while (true) {
                Optional<ContentChunk> next = channel.receive(idleTimeout);
                if (next.isEmpty()) {
                    throw new StreamFailedException(
                            "No content for thread " + threadId + " within " + idleTimeout.toMillis() + "ms");
                }
                ContentChunk chunk = next.get();
                if (chunk instanceof ContentChunk.Delta delta) {
                    content.append(delta.text());
                } else if (chunk instanceof ContentChunk.Failure failure) {
                    throw new StreamFailedException("Producer failed: " + failure.reason());
                } else {
                    channel.close();
                    return appendMessage(threadId, content.toString(), role);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamFailedException("Interrupted while streaming into thread " + threadId, e);
        } finally {
            channel.close();
        }
    }

    private ChatThread requireThread(String threadId) {
        return store.findThread(threadId).orElseThrow(() -> new UnknownThreadException(threadId));
    }

    private ChatThread requireActive(String threadId) {
        ChatThread thread = requireThread(threadId);
        if (!thread.isActive()) {
            throw new ThreadConflictException("Thread " + threadId + " is " + thread.status().value());
        }
        return thread;
    }
}

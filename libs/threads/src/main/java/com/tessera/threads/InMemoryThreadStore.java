package com.tessera.threads;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ThreadStore} held in memory. Each thread's messages are an immutable list swapped by
 * compare-and-set, the same discipline as the event streams.
 */
public class InMemoryThreadStore implements ThreadStore {

    private final Map<String, ChatThread> threads = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<List<ThreadMessage>>> chains = new ConcurrentHashMap<>();
    private final Map<String, ThreadMessage> messagesById = new ConcurrentHashMap<>();

    @Override
    public void insertThread(ChatThread thread) {
        if (threads.putIfAbsent(thread.id(), thread) != null) {
            throw new IllegalStateException("Thread already exists: " + thread.id());
        }
        chains.put(thread.id(), new AtomicReference<>(List.of()));
    }

    @Override
    public Optional<ChatThread> findThread(String threadId) {
        return Optional.ofNullable(threads.get(threadId));
    }

    @Override
    public boolean replaceThread(ChatThread expected, ChatThread updated) {
        return threads.replace(expected.id(), expected, updated);
    }

    @Override
    public List<ChatThread> childrenOf(String parentThreadId) {
        return threads.values().stream()
                .filter(t -> parentThreadId.equals(t.parentThreadId()))
                .sorted(Comparator.comparing(ChatThread::createdAt).thenComparing(ChatThread::id))
                .toList();
    }

    @Override
    public List<ThreadMessage> messages(String threadId) {
        var chain = chains.get(threadId);
        return chain == null ? List.of() : chain.get();
    }

    @Override
    public Optional<ThreadMessage> findMessage(String messageId) {
        return Optional.ofNullable(messagesById.get(messageId));
    }

    @Override
    public boolean appendIfTerminal(ThreadMessage message) {
        ChatThread thread = threads.get(message.threadId());
        var chain = chains.get(message.threadId());
        if (thread == null || chain == null) {
            throw new UnknownThreadException(message.threadId());
        }
        List<ThreadMessage> current = chain.get();
        String terminal = current.isEmpty() ? thread.seedHash() : current.get(current.size() - 1).hash();
        if (!terminal.equals(message.previousHash()) || message.position() != current.size() + 1) {
            return false;
        }
        var next = new ArrayList<ThreadMessage>(current.size() + 1);
        next.addAll(current);
        next.add(message);
        if (!chain.compareAndSet(current, List.copyOf(next))) {
            return false;
        }
        messagesById.put(message.id(), message);
        return true;
    }
}

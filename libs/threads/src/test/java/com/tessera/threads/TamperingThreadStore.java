package com.tessera.threads;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Serves rewritten content for chosen messages, as a corrupted database would. */
class TamperingThreadStore implements ThreadStore {

    private final ThreadStore delegate = new InMemoryThreadStore();
    private final Map<String, String> rewrites = new ConcurrentHashMap<>();

    void tamper(String messageId, String content) {
        rewrites.put(messageId, content);
    }

    @Override
    public void insertThread(ChatThread thread) {
        delegate.insertThread(thread);
    }

    @Override
    public Optional<ChatThread> findThread(String threadId) {
        return delegate.findThread(threadId);
    }

    @Override
    public boolean replaceThread(ChatThread expected, ChatThread updated) {
        return delegate.replaceThread(expected, updated);
    }

    @Override
    public List<ChatThread> childrenOf(String parentThreadId) {
        return delegate.childrenOf(parentThreadId);
    }

    @Override
    public List<ThreadMessage> messages(String threadId) {
        return delegate.messages(threadId).stream()
                .map(m -> rewrites.containsKey(m.id()) ? m.withContent(rewrites.get(m.id())) : m)
                .toList();
    }

    @Override
    public Optional<ThreadMessage> findMessage(String messageId) {
        return delegate.findMessage(messageId);
    }

    @Override
    public boolean appendIfTerminal(ThreadMessage message) {
        return delegate.appendIfTerminal(message);
    }
}

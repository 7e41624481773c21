package com.tessera.knowledgeservice.thread;

import com.tessera.eventmodel.DefaultSchemas;
import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.EventInput;
import com.tessera.eventmodel.EventPhase;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.knowledgeservice.infrastructure.web.ForbiddenException;
import com.tessera.observability.CorrelationContext;
import com.tessera.observability.CorrelationContextHolder;
import com.tessera.pipeline.publish.EventPublisher;
import com.tessera.threads.BranchNode;
import com.tessera.threads.ChainVerification;
import com.tessera.threads.ChatThread;
import com.tessera.threads.MergeResult;
import com.tessera.threads.MessageRole;
import com.tessera.threads.ThreadLog;
import com.tessera.threads.ThreadMessage;
import com.tessera.threads.UnknownThreadException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Thread operations on behalf of a user. Only a thread's owner may read or change it. Creating,
 * branching and merging also leave a {@code threads.*.completed} audit event in the log.
 */
@Service
public class ThreadService {

    private static final Logger log = LoggerFactory.getLogger(ThreadService.class);

    static final String SUBJECT_TYPE = "thread";

    private final ThreadLog threads;
    private final EventFactory factory;
    private final EventPublisher publisher;

    public ThreadService(ThreadLog threads, EventFactory factory, EventPublisher publisher) {
        this.threads = threads;
        this.factory = factory;
        this.publisher = publisher;
    }

    public ChatThread create(String userId, String title) {
        ChatThread thread = threads.createThread(userId, title);
        audit("create", userId, thread.id(), null, null, null);
        return thread;
    }

    public ChatThread get(String userId, String threadId) {
        return owned(userId, threadId);
    }

    public ThreadMessage append(String userId, String threadId, String content, MessageRole role) {
        owned(userId, threadId);
        if (role == MessageRole.SYSTEM) {
            throw new IllegalArgumentException("Role 'system' is reserved for merge summaries");
        }
        return threads.appendMessage(threadId, content, role);
    }

    public List<ThreadMessage> history(String userId, String threadId) {
        owned(userId, threadId);
        return threads.history(threadId);
    }

    public ChatThread branch(String userId, String threadId, String fromMessageId, String purpose) {
        owned(userId, threadId);
        ChatThread branch = threads.branch(threadId, fromMessageId, purpose);
        audit("branch", userId, branch.id(), threadId, fromMessageId, null);
        return branch;
    }

    public MergeResult merge(String userId, String branchId, String summary) {
        owned(userId, branchId);
        MergeResult result = threads.merge(branchId, summary);
        audit(
                "merge",
                userId,
                branchId,
                result.branch().parentThreadId(),
                result.summaryMessage().id(),
                result.branchTerminalHash());
        return result;
    }

    public ChainVerification verify(String userId, String threadId) {
        owned(userId, threadId);
        return threads.verify(threadId);
    }

    public ChatThread archive(String userId, String threadId) {
        owned(userId, threadId);
        return threads.archive(threadId);
    }

    public List<ChatThread> branches(String userId, String threadId) {
        owned(userId, threadId);
        return threads.listBranches(threadId);
    }

    public BranchNode tree(String userId, String threadId) {
        owned(userId, threadId);
        return threads.branchTree(threadId);
    }

    private ChatThread owned(String userId, String threadId) {
        ChatThread thread =
                threads.findThread(threadId).orElseThrow(() -> new UnknownThreadException(threadId));
        if (!thread.userId().equals(userId)) {
            throw new ForbiddenException("Thread " + threadId + " belongs to another user");
        }
        return thread;
    }

    private void audit(
            String action,
            String userId,
            String threadId,
            String parentThreadId,
            String messageId,
            String terminalHash) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("threadId", threadId);
        data.put("parentThreadId", parentThreadId);
        data.put("messageId", messageId);
        data.put("terminalHash", terminalHash);
        EventInput input =
                EventInput.of(
                                EventTypeName.of(DefaultSchemas.THREADS, action, EventPhase.COMPLETED),
                                userId,
                                data)
                        .withSubject(threadId, SUBJECT_TYPE)
                        .withSource(EventSource.SYSTEM)
                        .withCorrelation(
                                CorrelationContextHolder.get()
                                        .map(CorrelationContext::correlationId)
                                        .orElse(null),
                                null);
        EventEnvelope event = factory.createEvent(input);
        publisher.publish(event);
        log.debug("Recorded {} for thread {}", event.type(), threadId);
    }
}

package com.tessera.knowledgeservice.thread;

import com.tessera.knowledgeservice.infrastructure.web.RequestHeaders;
import com.tessera.threads.BranchNode;
import com.tessera.threads.ChainVerification;
import com.tessera.threads.ChatThread;
import com.tessera.threads.MergeResult;
import com.tessera.threads.MessageRole;
import com.tessera.threads.ThreadMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/threads")
public class ThreadController {

    private final ThreadService threads;

    public ThreadController(ThreadService threads) {
        this.threads = threads;
    }

    public record CreateThreadRequest(String title) {}

    /** @param role {@code user} when absent */
    public record AppendMessageRequest(@NotNull String content, String role) {}

    public record BranchRequest(@NotBlank String fromMessageId, String purpose) {}

    public record MergeRequest(String summary) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ChatThread create(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestBody(required = false) CreateThreadRequest request) {
        return threads.create(userId, request == null ? null : request.title());
    }

    @GetMapping("/{id}")
    public ChatThread get(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.get(userId, id);
    }

    @PostMapping("/{id}/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public ThreadMessage append(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @PathVariable String id,
            @Valid @RequestBody AppendMessageRequest request) {
        MessageRole role =
                request.role() == null
                        ? MessageRole.USER
                        : MessageRole.fromString(request.role())
                                .orElseThrow(
                                        () ->
                                                new IllegalArgumentException(
                                                        "Unknown role: " + request.role()));
        return threads.append(userId, id, request.content(), role);
    }

    @GetMapping("/{id}/messages")
    public List<ThreadMessage> messages(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.history(userId, id);
    }

    @PostMapping("/{id}/branches")
    @ResponseStatus(HttpStatus.CREATED)
    public ChatThread branch(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @PathVariable String id,
            @Valid @RequestBody BranchRequest request) {
        return threads.branch(userId, id, request.fromMessageId(), request.purpose());
    }

    @GetMapping("/{id}/branches")
    public List<ChatThread> branches(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.branches(userId, id);
    }

    @GetMapping("/{id}/tree")
    public BranchNode tree(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.tree(userId, id);
    }

    @PostMapping("/{id}/merge")
    public MergeResult merge(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @PathVariable String id,
            @RequestBody(required = false) MergeRequest request) {
        return threads.merge(userId, id, request == null ? null : request.summary());
    }

    @GetMapping("/{id}/verify")
    public ChainVerification verify(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.verify(userId, id);
    }

    @PostMapping("/{id}/archive")
    public ChatThread archive(
            @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable String id) {
        return threads.archive(userId, id);
    }
}

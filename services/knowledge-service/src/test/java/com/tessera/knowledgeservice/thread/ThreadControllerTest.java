package com.tessera.knowledgeservice.thread;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Thread endpoints")
class ThreadControllerTest {

    private static final String OWNER = "thread-owner";

    @Autowired private MockMvc mockMvc;

    private String createThread(String correlationId) throws Exception {
        String body =
                mockMvc.perform(
                                post("/api/v1/threads")
                                        .header("X-User-Id", OWNER)
                                        .header("X-Correlation-ID", correlationId)
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content("{\"title\": \"Trip planning\"}"))
                        .andExpect(status().isCreated())
                        .andExpect(jsonPath("$.kind").value("MAIN"))
                        .andExpect(jsonPath("$.seedHash").value(""))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    private ResultActions append(String threadId, String content) throws Exception {
        return mockMvc.perform(
                post("/api/v1/threads/{id}/messages", threadId)
                        .header("X-User-Id", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"" + content + "\"}"));
    }

    private String appendAndGetId(String threadId, String content) throws Exception {
        String body =
                append(threadId, content)
                        .andExpect(status().isCreated())
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    private List<String> correlatedTypes(String correlationId) throws Exception {
        String body =
                mockMvc.perform(get("/api/v1/correlations/{id}/events", correlationId))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$[*].type");
    }

    @Test
    @DisplayName("chains appended messages from the empty seed")
    void chainsMessages() throws Exception {
        String threadId = createThread("corr-" + UUID.randomUUID());
        String first =
                append(threadId, "hello")
                        .andExpect(status().isCreated())
                        .andExpect(jsonPath("$.position").value(1))
                        .andExpect(jsonPath("$.role").value("USER"))
                        .andExpect(jsonPath("$.previousHash").value(""))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        String firstHash = JsonPath.read(first, "$.hash");

        append(threadId, "world")
                .andExpect(jsonPath("$.position").value(2))
                .andExpect(jsonPath("$.previousHash").value(firstHash));

        mockMvc.perform(get("/api/v1/threads/{id}/messages", threadId).header("X-User-Id", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        mockMvc.perform(get("/api/v1/threads/{id}/verify", threadId).header("X-User-Id", OWNER))
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.checkedMessages").value(2));
    }

    @Test
    @DisplayName("branches, merges and audits both in the event log")
    void branchAndMerge() throws Exception {
        String correlationId = "corr-" + UUID.randomUUID();
        String threadId = createThread(correlationId);
        String m1 = appendAndGetId(threadId, "Where should we go?");

        String branchBody =
                mockMvc.perform(
                                post("/api/v1/threads/{id}/branches", threadId)
                                        .header("X-User-Id", OWNER)
                                        .header("X-Correlation-ID", correlationId)
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(
                                                "{\"fromMessageId\": \""
                                                        + m1
                                                        + "\", \"purpose\": \"research\"}"))
                        .andExpect(status().isCreated())
                        .andExpect(jsonPath("$.kind").value("BRANCH"))
                        .andExpect(jsonPath("$.parentThreadId").value(threadId))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        String branchId = JsonPath.read(branchBody, "$.id");
        appendAndGetId(branchId, "Lisbon looks good");

        mockMvc.perform(
                        post("/api/v1/threads/{id}/merge", branchId)
                                .header("X-User-Id", OWNER)
                                .header("X-Correlation-ID", correlationId)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"summary\": \"Lisbon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.branch.status").value("MERGED"))
                .andExpect(jsonPath("$.summaryMessage.role").value("SYSTEM"))
                .andExpect(
                        jsonPath("$.summaryMessage.content")
                                .value(startsWith("[merged branch " + branchId)));

        mockMvc.perform(get("/api/v1/threads/{id}/tree", threadId).header("X-User-Id", OWNER))
                .andExpect(jsonPath("$.thread.id").value(threadId))
                .andExpect(jsonPath("$.branches[0].thread.id").value(branchId));
        mockMvc.perform(get("/api/v1/threads/{id}/branches", threadId).header("X-User-Id", OWNER))
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(post("/api/v1/threads/{id}/merge", branchId).header("X-User-Id", OWNER))
                .andExpect(status().isConflict());

        assertThat(correlatedTypes(correlationId))
                .containsExactly(
                        "threads.create.completed",
                        "threads.branch.completed",
                        "threads.merge.completed");
    }

    @Nested
    @DisplayName("guards")
    class Guards {

        @Test
        @DisplayName("another user gets 403")
        void otherUser() throws Exception {
            String threadId = createThread("corr-" + UUID.randomUUID());

            mockMvc.perform(get("/api/v1/threads/{id}", threadId).header("X-User-Id", "intruder"))
                    .andExpect(status().isForbidden());
            mockMvc.perform(
                            post("/api/v1/threads/{id}/messages", threadId)
                                    .header("X-User-Id", "intruder")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"content\": \"hi\"}"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("an unknown thread is a 404")
        void unknownThread() throws Exception {
            mockMvc.perform(get("/api/v1/threads/{id}", "missing").header("X-User-Id", OWNER))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("an archived thread refuses appends")
        void archived() throws Exception {
            String threadId = createThread("corr-" + UUID.randomUUID());

            mockMvc.perform(post("/api/v1/threads/{id}/archive", threadId).header("X-User-Id", OWNER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ARCHIVED"));
            append(threadId, "too late").andExpect(status().isConflict());
        }

        @Test
        @DisplayName("clients cannot write system messages")
        void systemRole() throws Exception {
            String threadId = createThread("corr-" + UUID.randomUUID());

            mockMvc.perform(
                            post("/api/v1/threads/{id}/messages", threadId)
                                    .header("X-User-Id", OWNER)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"content\": \"x\", \"role\": \"system\"}"))
                    .andExpect(status().isBadRequest());
        }
    }
}

package com.tessera.knowledgeservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
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

/**
 * Commands end to end through HTTP. Dispatch is inline on the test profile, so each command has
 * reached its final phase when the submission returns.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Command submission")
class CommandFlowTest {

    @Autowired private MockMvc mockMvc;

    private String submit(String userId, String body) throws Exception {
        return mockMvc.perform(
                        post("/api/v1/commands")
                                .header("X-User-Id", userId)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("requested"))
                .andReturn()
                .getResponse()
                .getContentAsString();
    }

    private List<String> correlatedTypes(String correlationId) throws Exception {
        String body =
                mockMvc.perform(get("/api/v1/correlations/{id}/events", correlationId))
                        .andExpect(status().isOk())
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$[*].type");
    }

    @Nested
    @DisplayName("a person's command")
    class PersonalCommand {

        @Test
        @DisplayName("runs requested, validated, completed")
        void completes() throws Exception {
            String subjectId = UUID.randomUUID().toString();
            String receipt =
                    submit(
                            "user-a",
                            """
                            {"type": "entities.create.requested", "subjectId": "%s",
                             "data": {"entityType": "note", "title": "Groceries", "content": "milk"}}
                            """
                                    .formatted(subjectId));
            String correlationId = JsonPath.read(receipt, "$.correlationId");

            assertThat(correlatedTypes(correlationId))
                    .containsExactly(
                            "entities.create.requested",
                            "entities.create.validated",
                            "entities.create.completed");
        }

        @Test
        @DisplayName("inherits the request's correlation id")
        void inheritsCorrelation() throws Exception {
            String correlationId = "corr-" + UUID.randomUUID();
            String body =
                    mockMvc.perform(
                                    post("/api/v1/commands")
                                            .header("X-User-Id", "user-a")
                                            .header("X-Correlation-ID", correlationId)
                                            .contentType(MediaType.APPLICATION_JSON)
                                            .content(
                                                    """
                                                    {"type": "entities.create.requested",
                                                     "data": {"entityType": "task", "title": "Call"}}
                                                    """))
                            .andExpect(status().isAccepted())
                            .andReturn()
                            .getResponse()
                            .getContentAsString();

            assertThat((String) JsonPath.read(body, "$.correlationId")).isEqualTo(correlationId);
            assertThat(correlatedTypes(correlationId)).contains("entities.create.completed");
        }

        @Test
        @DisplayName("the requested event can be read back with its version")
        void readBack() throws Exception {
            String subjectId = UUID.randomUUID().toString();
            String receipt =
                    submit(
                            "user-a",
                            """
                            {"type": "entities.create.requested", "subjectId": "%s",
                             "data": {"entityType": "note", "title": "Read me"}}
                            """
                                    .formatted(subjectId));
            String id = JsonPath.read(receipt, "$.id");

            mockMvc.perform(get("/api/v1/events/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.type").value("entities.create.requested"))
                    .andExpect(jsonPath("$.subjectId").value(subjectId))
                    .andExpect(jsonPath("$.version").value(1))
                    .andExpect(jsonPath("$.source").value("user"))
                    .andExpect(jsonPath("$.data.title").value("Read me"));

            mockMvc.perform(get("/api/v1/aggregates/{id}/events", subjectId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].version").value(1))
                    .andExpect(
                            jsonPath("$[*].type")
                                    .value(hasItems("entities.create.requested", "entities.create.validated")));
        }
    }

    @Nested
    @DisplayName("an AI proposal on a personal resource")
    class AiProposal {

        private String propose(String userId) throws Exception {
            String receipt =
                    submit(
                            userId,
                            """
                            {"type": "entities.create.requested", "source": "intelligence",
                             "data": {"entityType": "note", "title": "Suggested"}}
                            """);
            return JsonPath.read(receipt, "$.correlationId");
        }

        private String pendingEventId(String userId, String correlationId) throws Exception {
            String body =
                    mockMvc.perform(get("/api/v1/correlations/{id}/events", correlationId))
                            .andReturn()
                            .getResponse()
                            .getContentAsString();
            List<String> ids = JsonPath.read(body, "$[?(@.type == 'entities.create.pending')].id");
            assertThat(ids).hasSize(1);
            return ids.get(0);
        }

        @Test
        @DisplayName("waits for the user and shows up in their approvals")
        void waits() throws Exception {
            String correlationId = propose("user-b");

            assertThat(correlatedTypes(correlationId))
                    .containsExactly("entities.create.requested", "entities.create.pending");
            String pendingId = pendingEventId("user-b", correlationId);
            mockMvc.perform(get("/api/v1/approvals").header("X-User-Id", "user-b"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[*].pendingEventId").value(hasItem(pendingId)));
            mockMvc.perform(get("/api/v1/approvals").header("X-User-Id", "someone-else"))
                    .andExpect(jsonPath("$[*].pendingEventId").value(not(hasItem(pendingId))));
        }

        @Test
        @DisplayName("approval re-submits it and it completes")
        void approve() throws Exception {
            String correlationId = propose("user-c");
            String pendingId = pendingEventId("user-c", correlationId);

            mockMvc.perform(post("/api/v1/approvals/{id}/approve", pendingId).header("X-User-Id", "user-c"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.type").value("entities.create.requested"));

            assertThat(correlatedTypes(correlationId))
                    .contains("entities.create.validated", "entities.create.completed");
            mockMvc.perform(post("/api/v1/approvals/{id}/approve", pendingId).header("X-User-Id", "user-c"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("rejection denies it")
        void reject() throws Exception {
            String correlationId = propose("user-d");
            String pendingId = pendingEventId("user-d", correlationId);

            mockMvc.perform(
                            post("/api/v1/approvals/{id}/reject", pendingId)
                                    .header("X-User-Id", "user-d")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"reason\": \"not useful\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.type").value("entities.create.denied"));

            assertThat(correlatedTypes(correlationId)).doesNotContain("entities.create.completed");
        }

        @Test
        @DisplayName("only a listed approver may decide")
        void strangerCannotDecide() throws Exception {
            String correlationId = propose("user-e");
            String pendingId = pendingEventId("user-e", correlationId);

            mockMvc.perform(post("/api/v1/approvals/{id}/approve", pendingId).header("X-User-Id", "mallory"))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("workspace roles")
    class WorkspaceRoles {

        @Test
        @DisplayName("a viewer's write is denied, an editor's completes")
        void viewerDeniedEditorAllowed() throws Exception {
            String workspaceId = "ws-" + UUID.randomUUID();
            mockMvc.perform(
                            put("/api/v1/workspaces/{id}", workspaceId)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"ownerId\": \"owner-1\", \"aiAutoApprove\": false}"))
                    .andExpect(status().isOk());
            mockMvc.perform(
                            put("/api/v1/workspaces/{id}/members/{user}", workspaceId, "viewer-1")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"role\": \"viewer\"}"))
                    .andExpect(status().isOk());
            mockMvc.perform(
                            put("/api/v1/workspaces/{id}/members/{user}", workspaceId, "editor-1")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"role\": \"editor\"}"))
                    .andExpect(status().isOk());
            String command =
                    """
                    {"type": "entities.create.requested",
                     "data": {"entityType": "note", "title": "Shared", "workspaceId": "%s"}}
                    """
                            .formatted(workspaceId);

            String viewer = JsonPath.read(submit("viewer-1", command), "$.correlationId");
            String editor = JsonPath.read(submit("editor-1", command), "$.correlationId");

            assertThat(correlatedTypes(viewer))
                    .containsExactly("entities.create.requested", "entities.create.denied");
            assertThat(correlatedTypes(editor)).contains("entities.create.completed");
        }
    }

    @Nested
    @DisplayName("rejected submissions")
    class Rejected {

        @Test
        @DisplayName("a schema violation is a 400 problem and nothing is stored")
        void schemaViolation() throws Exception {
            String correlationId = "corr-" + UUID.randomUUID();
            mockMvc.perform(
                            post("/api/v1/commands")
                                    .header("X-User-Id", "user-a")
                                    .header("X-Correlation-ID", correlationId)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"type\": \"entities.create.requested\", \"data\": {\"title\": \"x\"}}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Schema Violation"))
                    .andExpect(jsonPath("$.correlationId").value(correlationId))
                    .andExpect(jsonPath("$.errors").isArray());

            assertThat(correlatedTypes(correlationId)).isEmpty();
        }

        @Test
        @DisplayName("a malformed type is a 400")
        void malformedType() throws Exception {
            mockMvc.perform(
                            post("/api/v1/commands")
                                    .header("X-User-Id", "user-a")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"type\": \"entities-create\", \"data\": {}}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a non-requested phase is a 400")
        void notRequested() throws Exception {
            mockMvc.perform(
                            post("/api/v1/commands")
                                    .header("X-User-Id", "user-a")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(
                                            "{\"type\": \"entities.create.completed\", \"data\": {\"entityType\": \"note\"}}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("the system source is reserved")
        void systemSource() throws Exception {
            mockMvc.perform(
                            post("/api/v1/commands")
                                    .header("X-User-Id", "user-a")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(
                                            "{\"type\": \"entities.create.requested\", \"source\": \"system\","
                                                    + " \"data\": {\"entityType\": \"note\"}}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a missing user header is a 401")
        void missingUser() throws Exception {
            mockMvc.perform(
                            post("/api/v1/commands")
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"type\": \"entities.create.requested\", \"data\": {}}"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("an unknown event is a 404")
        void unknownEvent() throws Exception {
            mockMvc.perform(get("/api/v1/events/{id}", UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("a malformed event id is a 400")
        void malformedEventId() throws Exception {
            mockMvc.perform(get("/api/v1/events/not-a-uuid")).andExpect(status().isBadRequest());
        }
    }
}

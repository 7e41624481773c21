package com.tessera.knowledgeservice.insight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Insight submission")
class InsightControllerTest {

    @Autowired private MockMvc mockMvc;

    private String issueToken(String userId, String requestId) throws Exception {
        String body =
                mockMvc.perform(
                                post("/api/v1/insights/tokens")
                                        .header("X-User-Id", userId)
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content("{\"requestId\": \"" + requestId + "\"}"))
                        .andExpect(status().isCreated())
                        .andExpect(jsonPath("$.requestId").value(requestId))
                        .andExpect(jsonPath("$.expiresAt").isNotEmpty())
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        return JsonPath.read(body, "$.token");
    }

    private static String insight(String correlationId) {
        return """
                {"correlationId": "%s", "confidence": 0.82, "agent": "planner",
                 "reasoning": "mentioned twice",
                 "actions": [
                   {"eventType": "entities.create.requested",
                    "data": {"entityType": "task", "title": "Book flights"}},
                   {"eventType": "entities.create.requested", "data": {"title": "missing type"}}
                 ]}
                """
                .formatted(correlationId);
    }

    @Test
    @DisplayName("publishes each valid action as an intelligence command awaiting review")
    void publishesActions() throws Exception {
        String requestId = UUID.randomUUID().toString();
        String token = issueToken("user-i", requestId);

        String body =
                mockMvc.perform(
                                post("/api/v1/insights")
                                        .header("Authorization", "Bearer " + token)
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(insight(requestId)))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.eventsPublished").value(1))
                        .andExpect(jsonPath("$.failures[0].actionIndex").value(1))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();

        String eventId = JsonPath.read(body, "$.eventIds[0]");
        mockMvc.perform(get("/api/v1/events/{id}", eventId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("intelligence"))
                .andExpect(jsonPath("$.userId").value("user-i"))
                .andExpect(jsonPath("$.correlationId").value(requestId))
                .andExpect(jsonPath("$.requestId").value(requestId))
                .andExpect(jsonPath("$.metadata.ai.agent").value("planner"))
                .andExpect(jsonPath("$.metadata.ai.confidence.score").value(0.82));

        String events =
                mockMvc.perform(get("/api/v1/correlations/{id}/events", requestId))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        List<String> types = JsonPath.read(events, "$[*].type");
        assertThat(types).containsExactly("entities.create.requested", "entities.create.pending");
    }

    @Test
    @DisplayName("a null action is reported as a failed action, the others still publish")
    void nullAction() throws Exception {
        String requestId = UUID.randomUUID().toString();
        String token = issueToken("user-i", requestId);
        String body =
                """
                {"correlationId": "%s", "confidence": 0.5,
                 "actions": [null,
                   {"eventType": "entities.create.requested", "data": {"entityType": "note"}}]}
                """
                        .formatted(requestId);

        mockMvc.perform(
                        post("/api/v1/insights")
                                .header("Authorization", "Bearer " + token)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventsPublished").value(1))
                .andExpect(jsonPath("$.failures[0].actionIndex").value(0))
                .andExpect(jsonPath("$.failures[0].error").value(containsString("must not be null")));
    }

    @Test
    @DisplayName("rejects a correlation id other than the token's request id")
    void correlationMismatch() throws Exception {
        String requestId = UUID.randomUUID().toString();
        String token = issueToken("user-i", requestId);
        String other = UUID.randomUUID().toString();

        mockMvc.perform(
                        post("/api/v1/insights")
                                .header("Authorization", "Bearer " + token)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(insight(other)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("mismatch")));

        String events =
                mockMvc.perform(get("/api/v1/correlations/{id}/events", other))
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        assertThat(JsonPath.<List<String>>read(events, "$[*].id")).isEmpty();
    }

    @Test
    @DisplayName("requires a known bearer token")
    void requiresToken() throws Exception {
        String requestId = UUID.randomUUID().toString();

        mockMvc.perform(
                        post("/api/v1/insights")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(insight(requestId)))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(
                        post("/api/v1/insights")
                                .header("Authorization", "Bearer forged")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(insight(requestId)))
                .andExpect(status().isUnauthorized());
    }
}

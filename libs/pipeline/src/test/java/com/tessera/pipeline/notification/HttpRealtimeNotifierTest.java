package com.tessera.pipeline.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("HttpRealtimeNotifier")
class HttpRealtimeNotifierTest {

    private static final String BASE = "http://realtime.test";

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private MockRestServiceServer server;
    private HttpRealtimeNotifier notifier;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        notifier = new HttpRealtimeNotifier(builder, BASE, new MetricFactory(meters, "notifier-test"));
    }

    @Test
    @DisplayName("pushes to the user room and the request room")
    void bothRooms() {
        server.expect(requestTo(BASE + "/rooms/user_alice/broadcast"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.type").value("entities.create.completed"))
                .andExpect(jsonPath("$.data.entityId").value("e-1"))
                .andRespond(withSuccess());
        server.expect(requestTo(BASE + "/rooms/request_r-9/broadcast")).andRespond(withSuccess());

        NotificationOutcome outcome =
                notifier.notify(
                        new RealtimeMessage("alice", "r-9", "entities.create.completed", Map.of("entityId", "e-1")));

        assertThat(outcome).isEqualTo(NotificationOutcome.DELIVERED);
        server.verify();
    }

    @Test
    @DisplayName("without a request id only the user room is used")
    void userRoomOnly() {
        server.expect(requestTo(BASE + "/rooms/user_bob/broadcast")).andRespond(withSuccess());

        assertThat(notifier.notify(new RealtimeMessage("bob", null, "t", Map.of())))
                .isEqualTo(NotificationOutcome.DELIVERED);
        server.verify();
    }

    @Test
    @DisplayName("a message with no room is skipped")
    void noRoom() {
        assertThat(notifier.notify(new RealtimeMessage(null, null, "t", Map.of())))
                .isEqualTo(NotificationOutcome.SKIPPED);
        server.verify();
    }

    @Test
    @DisplayName("a failed push is reported and counted, never thrown")
    void failure() {
        server.expect(requestTo(BASE + "/rooms/user_alice/broadcast")).andRespond(withServerError());

        NotificationOutcome outcome = notifier.notify(new RealtimeMessage("alice", "r-1", "t", Map.of()));

        assertThat(outcome).isEqualTo(NotificationOutcome.FAILED);
        assertThat(meters.find("tessera.notifications.failures").counter().count()).isEqualTo(1.0);
    }
}

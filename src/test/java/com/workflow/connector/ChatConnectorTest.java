package com.workflow.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflow.exception.ActionParameterException;
import com.workflow.exception.TransientActionException;
import com.workflow.exception.WorkflowException;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatConnectorTest {

    private MockWebServer mockWebServer;
    private ChatConnector chatConnector;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        chatConnector = new ChatConnector(WebClient.builder().build(), mockWebServer.url("/hooks/chat").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void send_shouldPostChannelAndTextAndReturnResponse() throws Exception {
        // --- Arrange ---
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"ok\":true,\"ts\":\"1700000000.1\"}")
                .addHeader("Content-Type", "application/json"));

        // --- Act ---
        Object result = chatConnector.send(Map.of("channel", "#sales", "message", "Pipeline is ready", "rowCount", 3));

        // --- Assert ---
        assertThat(result).isInstanceOf(JsonNode.class);
        assertThat(((JsonNode) result).get("ok").asBoolean()).isTrue();

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/chat");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.get("channel").asText()).isEqualTo("#sales");
        assertThat(body.get("text").asText()).isEqualTo("Pipeline is ready (3 rows)");
        assertThat(body.has("attachment")).isFalse();
    }

    @Test
    void send_shouldReturnReceiptWhenWebhookHasNoBody() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));

        Object result = chatConnector.send(Map.of("channel", "#ops", "message", "Deploy finished"));

        assertThat(result).isEqualTo(Map.of("channel", "#ops", "delivered", true));
    }

    @Test
    void send_shouldTreatClientErrorAsPermanent() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(400).setBody("channel_not_found"));

        assertThatThrownBy(() -> chatConnector.send(Map.of("channel", "#nowhere", "message", "hi")))
                .isInstanceOf(WorkflowException.class)
                .isNotInstanceOf(TransientActionException.class)
                .hasMessageContaining("400")
                .hasMessageContaining("channel_not_found");
    }

    @Test
    void send_shouldTreatServerErrorAsTransient() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> chatConnector.send(Map.of("channel", "#ops", "message", "hi")))
                .isInstanceOf(TransientActionException.class);
    }

    @Test
    void send_shouldRequireChannelAndMessage() {
        assertThatThrownBy(() -> chatConnector.send(Map.of("message", "hi")))
                .isInstanceOf(ActionParameterException.class)
                .hasMessageContaining("channel");
        assertThatThrownBy(() -> chatConnector.send(Map.of("channel", "#ops")))
                .isInstanceOf(ActionParameterException.class)
                .hasMessageContaining("message");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }
}

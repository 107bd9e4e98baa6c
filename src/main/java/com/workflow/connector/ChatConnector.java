package com.workflow.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflow.action.ActionParameters;
import com.workflow.exception.TransientActionException;
import com.workflow.exception.WorkflowException;
import com.workflow.model.GeneratedReport;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import static com.workflow.service.impl.PlanTemplates.SEND_CHAT_MESSAGE;

/**
 * Posts messages to a chat system through an incoming-webhook endpoint.
 */
@Component
@Slf4j
public class ChatConnector {

    private final WebClient webClient;
    private final String webhookUrl;

    public ChatConnector(WebClient webClient, @Value("${workflow.chat.webhook-url:http://localhost:8089/hooks/chat}") String webhookUrl) {
        this.webClient = webClient;
        this.webhookUrl = webhookUrl;
    }

    /**
     * Handler for {@code send_chat_message}.
     * <p>
     * Requires {@code channel} and {@code message}. Accepts {@code rowCount}, which is appended
     * to the text, and {@code attachment} (a {@link GeneratedReport} or a reference string).
     *
     * @return The webhook's JSON response, or a receipt if the webhook returned no body.
     */
    public Object send(Map<String, Object> parameters) {
        ActionParameters params = ActionParameters.of(SEND_CHAT_MESSAGE, parameters);
        String channel = params.requireString("channel");
        String message = params.requireString("message");
        Integer rowCount = params.optionalInt("rowCount");
        Object attachment = params.raw("attachment");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", rowCount != null ? message + " (" + rowCount + " rows)" : message);
        if (attachment instanceof GeneratedReport report) {
            payload.put("attachment", report.path().toString());
        } else if (attachment != null) {
            payload.put("attachment", String.valueOf(attachment));
        }

        try {
            JsonNode response = webClient.post()
                    .uri(webhookUrl)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            log.info("Posted message to chat channel '{}'.", channel);
            if (response != null) {
                return response;
            }
            Map<String, Object> receipt = new LinkedHashMap<>();
            receipt.put("channel", channel);
            receipt.put("delivered", true);
            return receipt;
        } catch (WebClientResponseException e) {
            log.error("Chat webhook for channel '{}' failed with status {} and body: {}", channel, e.getStatusCode(), e.getResponseBodyAsString());
            String detail = "Chat webhook returned " + e.getStatusCode().value() + " " + e.getResponseBodyAsString();
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientActionException(detail, e);
            }
            throw new WorkflowException(detail, e);
        } catch (WebClientRequestException e) {
            throw new TransientActionException("Could not reach chat webhook at " + webhookUrl + ": " + e.getMessage(), e);
        }
    }
}

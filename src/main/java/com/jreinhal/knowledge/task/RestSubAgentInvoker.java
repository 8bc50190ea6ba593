package com.jreinhal.knowledge.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.knowledge.config.SubAgentProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Calls a remote agent with a JSON-RPC {@code tasks/send} request.
 */
@Component
public class RestSubAgentInvoker implements SubAgentInvoker {
    private static final Logger log = LoggerFactory.getLogger(RestSubAgentInvoker.class);

    private final RestClient restClient;

    public RestSubAgentInvoker(RestClient.Builder builder, SubAgentProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(30));
        requestFactory.setReadTimeout(Duration.ofMinutes(Math.max(1, properties.getTimeoutMinutes())));
        this.restClient = builder.requestFactory(requestFactory).build();
    }

    @Override
    public String invoke(SubAgentProperties.SubAgent agent, String task) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "method", "tasks/send",
                "id", "async-" + System.nanoTime(),
                "params", Map.of("message", Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", task)))));
        JsonNode response;
        try {
            response = this.restClient.post()
                    .uri(agent.getEndpoint() + "/a2a")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> this.applyAuth(agent, headers))
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        }
        catch (RestClientException e) {
            throw new SubAgentException("Sub-agent '" + agent.getName() + "' request failed: " + e.getMessage(), e);
        }
        return extractText(response);
    }

    private void applyAuth(SubAgentProperties.SubAgent agent, HttpHeaders headers) {
        if (agent.getAuthToken() == null || agent.getAuthToken().isBlank()) {
            return;
        }
        if (agent.getAuthHeader() == null || agent.getAuthHeader().isBlank()) {
            headers.setBearerAuth(agent.getAuthToken());
        }
        else {
            headers.set(agent.getAuthHeader(), agent.getAuthToken());
        }
    }

    static String extractText(JsonNode response) {
        if (response == null || response.isNull()) {
            throw new SubAgentException("Sub-agent returned an empty response");
        }
        JsonNode error = response.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new SubAgentException("Sub-agent error: " + error.path("message").asText(error.toString()));
        }
        JsonNode text = response.path("result").path("artifacts").path(0).path("parts").path(0).path("text");
        if (text.isTextual()) {
            return text.asText();
        }
        log.debug("Sub-agent response had no artifact text, returning raw result");
        return "Response: " + response.path("result");
    }
}

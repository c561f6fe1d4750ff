package com.groceryshopper.chat.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.GenerationParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * OpenAI-compatible {@code /chat/completions} backend. Roles are passed through unchanged.
 */
@Slf4j
@Component
public class OpenAiGenerationProvider implements GenerationProvider {

    public static final String BACKEND_ID = "openai";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public OpenAiGenerationProvider(RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${llm.openai.base-url:https://api.openai.com/v1}") String baseUrl,
                                    @Value("${llm.openai.api-key:}") String apiKey,
                                    @Value("${llm.openai.model:gpt-4o-mini}") String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
    }

    @Override
    public String backendId() {
        return BACKEND_ID;
    }

    @Override
    public boolean isAvailable() {
        return !apiKey.isEmpty();
    }

    @Override
    public String generate(List<ChatTurn> turns, GenerationParams params) {
        if (apiKey.isEmpty()) {
            throw new BackendUnavailableException(BACKEND_ID, "OpenAI API key is not configured");
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", params.getTemperature());
        body.put("max_tokens", params.getMaxTokens());
        body.put("stream", false);
        ArrayNode messages = body.putArray("messages");
        for (ChatTurn turn : turns) {
            messages.addObject()
                    .put("role", turn.getRole().getWireName())
                    .put("content", turn.getContent());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(baseUrl + "/chat/completions", HttpMethod.POST,
                    new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.unavailable(BACKEND_ID, e);
        }

        JsonNode root = response.getBody();
        if (root == null) {
            throw new BackendUnavailableException(BACKEND_ID, "OpenAI returned an empty body");
        }

        JsonNode choice = root.path("choices").path(0);
        if ("content_filter".equals(choice.path("finish_reason").asText())) {
            throw new BackendRejectedException(BACKEND_ID, "finish_reason=content_filter");
        }
        JsonNode refusal = choice.path("message").path("refusal");
        if (refusal.isTextual() && !refusal.asText().isBlank()) {
            throw new BackendRejectedException(BACKEND_ID, refusal.asText());
        }

        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual()) {
            throw new BackendUnavailableException(BACKEND_ID, "OpenAI reply has no message content");
        }
        return content.asText();
    }
}

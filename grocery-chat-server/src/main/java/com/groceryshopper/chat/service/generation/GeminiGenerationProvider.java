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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Google Gemini {@code generateContent} backend.
 * <p>
 * Gemini has no system or assistant role in {@code contents}: system turns are joined into
 * {@code systemInstruction} and assistant turns are sent as {@code model}.
 */
@Slf4j
@Component
public class GeminiGenerationProvider implements GenerationProvider {

    public static final String BACKEND_ID = "gemini";

    private static final Set<String> BLOCKING_FINISH_REASONS =
            Set.of("SAFETY", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII", "RECITATION");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public GeminiGenerationProvider(RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${llm.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                                    @Value("${llm.gemini.api-key:}") String apiKey,
                                    @Value("${llm.gemini.model:gemini-1.5-flash}") String model) {
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

    static String toGeminiRole(ChatTurn.Role role) {
        return role == ChatTurn.Role.ASSISTANT ? "model" : "user";
    }

    @Override
    public String generate(List<ChatTurn> turns, GenerationParams params) {
        if (apiKey.isEmpty()) {
            throw new BackendUnavailableException(BACKEND_ID, "Gemini API key is not configured");
        }

        ObjectNode body = objectMapper.createObjectNode();
        List<String> systemParts = new ArrayList<>();
        ArrayNode contents = body.putArray("contents");
        for (ChatTurn turn : turns) {
            if (turn.getRole() == ChatTurn.Role.SYSTEM) {
                systemParts.add(turn.getContent());
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", toGeminiRole(turn.getRole()));
            content.putArray("parts").addObject().put("text", turn.getContent());
        }
        if (!systemParts.isEmpty()) {
            body.putObject("systemInstruction")
                    .putArray("parts").addObject().put("text", String.join("\n\n", systemParts));
        }
        body.putObject("generationConfig")
                .put("temperature", params.getTemperature())
                .put("maxOutputTokens", params.getMaxTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        String url = baseUrl + "/v1beta/models/" + model + ":generateContent";
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.unavailable(BACKEND_ID, e);
        }

        JsonNode root = response.getBody();
        if (root == null) {
            throw new BackendUnavailableException(BACKEND_ID, "Gemini returned an empty body");
        }
        return extractText(root);
    }

    private String extractText(JsonNode root) {
        JsonNode blockReason = root.path("promptFeedback").path("blockReason");
        if (blockReason.isTextual()) {
            throw new BackendRejectedException(BACKEND_ID, "prompt blocked: " + blockReason.asText());
        }

        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            throw new BackendRejectedException(BACKEND_ID, "no candidates returned");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }

        String finishReason = candidate.path("finishReason").asText("");
        if (text.length() == 0 && BLOCKING_FINISH_REASONS.contains(finishReason)) {
            throw new BackendRejectedException(BACKEND_ID, "finishReason=" + finishReason);
        }
        return text.toString();
    }
}

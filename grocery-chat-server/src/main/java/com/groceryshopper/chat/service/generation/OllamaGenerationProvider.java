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

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Local TinyLlama served by Ollama ({@code /api/chat}). Roles are passed through unchanged.
 */
@Slf4j
@Component
public class OllamaGenerationProvider implements GenerationProvider {

    public static final String BACKEND_ID = "tinyllama";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;

    public OllamaGenerationProvider(RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${llm.ollama.base-url:http://localhost:11434}") String baseUrl,
                                    @Value("${llm.ollama.model:tinyllama}") String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.model = model;
    }

    @Override
    public String backendId() {
        return BACKEND_ID;
    }

    public String getModel() {
        return model;
    }

    @Override
    public String generate(List<ChatTurn> turns, GenerationParams params) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("stream", false);
        ArrayNode messages = body.putArray("messages");
        for (ChatTurn turn : turns) {
            messages.addObject()
                    .put("role", turn.getRole().getWireName())
                    .put("content", turn.getContent());
        }
        body.putObject("options")
                .put("temperature", params.getTemperature())
                .put("num_predict", params.getMaxTokens());

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(baseUrl + "/api/chat", HttpMethod.POST,
                    new HttpEntity<>(body, jsonHeaders()), JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.unavailable(BACKEND_ID, e);
        }

        JsonNode root = response.getBody();
        JsonNode content = root == null ? null : root.path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new BackendUnavailableException(BACKEND_ID, "Ollama reply has no message content");
        }
        return content.asText();
    }

    /**
     * True when the configured model has been pulled into the local Ollama
     */
    @Override
    public boolean isAvailable() {
        try {
            JsonNode tags = restTemplate.getForObject(baseUrl + "/api/tags", JsonNode.class);
            if (tags == null) {
                return false;
            }
            for (JsonNode installed : tags.path("models")) {
                String name = installed.path("name").asText("");
                if (name.equals(model) || name.startsWith(model + ":")) {
                    return true;
                }
            }
            return false;
        } catch (RestClientException e) {
            log.debug("Ollama not reachable at {}: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    /**
     * Pull the configured model, reporting every NDJSON status line Ollama streams back.
     * Blocks until the pull ends.
     *
     * @throws BackendUnavailableException if Ollama cannot be reached or reports an error
     */
    public void pullModel(Consumer<JsonNode> onStatus) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", model);
        body.put("stream", true);

        try {
            restTemplate.execute(baseUrl + "/api/pull", HttpMethod.POST,
                    request -> {
                        request.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                        objectMapper.writeValue(request.getBody(), body);
                    },
                    response -> {
                        try (BufferedReader reader = new BufferedReader(
                                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                            String line;
                            while ((line = reader.readLine()) != null) {
                                if (line.isBlank()) {
                                    continue;
                                }
                                JsonNode status = objectMapper.readTree(line);
                                if (status.hasNonNull("error")) {
                                    throw new BackendUnavailableException(BACKEND_ID,
                                            "Ollama pull failed: " + status.get("error").asText());
                                }
                                onStatus.accept(status);
                            }
                        }
                        return null;
                    });
        } catch (RestClientException e) {
            throw ProviderErrors.unavailable(BACKEND_ID, e);
        }
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}

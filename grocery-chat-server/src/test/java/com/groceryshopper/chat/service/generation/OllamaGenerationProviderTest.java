package com.groceryshopper.chat.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.GenerationParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaGenerationProviderTest {

    private MockRestServiceServer server;
    private OllamaGenerationProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new OllamaGenerationProvider(restTemplate, new ObjectMapper(), "http://ollama.test", "tinyllama");
    }

    @Test
    @DisplayName("Should call /api/chat without streaming and read message.content")
    void chat() {
        server.expect(requestTo("http://ollama.test/api/chat"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.stream").value(false))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.options.num_predict").value(512))
                .andRespond(withSuccess("{\"message\":{\"role\":\"assistant\",\"content\":\"Sure.\"},\"done\":true}",
                        MediaType.APPLICATION_JSON));

        String reply = provider.generate(List.of(ChatTurn.system("s"), ChatTurn.user("u")), GenerationParams.defaults());

        assertThat(reply).isEqualTo("Sure.");
        server.verify();
    }

    @Test
    @DisplayName("Should report available only when the model is pulled")
    void availability() {
        server.expect(requestTo("http://ollama.test/api/tags"))
                .andRespond(withSuccess("{\"models\":[{\"name\":\"tinyllama:latest\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://ollama.test/api/tags"))
                .andRespond(withSuccess("{\"models\":[{\"name\":\"llama3:8b\"}]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://ollama.test/api/tags"))
                .andRespond(withServerError());

        assertThat(provider.isAvailable()).isTrue();
        assertThat(provider.isAvailable()).isFalse();
        assertThat(provider.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Should relay every pull status line")
    void pullStreamsStatus() {
        server.expect(requestTo("http://ollama.test/api/pull"))
                .andExpect(jsonPath("$.name").value("tinyllama"))
                .andRespond(withSuccess(
                        "{\"status\":\"pulling manifest\"}\n"
                                + "{\"status\":\"downloading\",\"total\":100,\"completed\":40}\n"
                                + "{\"status\":\"success\"}\n",
                        MediaType.parseMediaType("application/x-ndjson")));

        List<JsonNode> statuses = new ArrayList<>();
        provider.pullModel(statuses::add);

        assertThat(statuses).extracting(node -> node.path("status").asText())
                .containsExactly("pulling manifest", "downloading", "success");
    }

    @Test
    @DisplayName("An error line during pull should fail the pull")
    void pullError() {
        server.expect(requestTo("http://ollama.test/api/pull"))
                .andRespond(withSuccess("{\"error\":\"model not found\"}\n",
                        MediaType.parseMediaType("application/x-ndjson")));

        assertThatThrownBy(() -> provider.pullModel(status -> { }))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("model not found");
    }
}

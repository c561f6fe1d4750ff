package com.groceryshopper.chat.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.GenerationParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiGenerationProviderTest {

    private static final String URL = "http://gemini.test/v1beta/models/gemini-1.5-flash:generateContent";

    private MockRestServiceServer server;
    private GeminiGenerationProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new GeminiGenerationProvider(restTemplate, new ObjectMapper(),
                "http://gemini.test", "test-key", "gemini-1.5-flash");
    }

    @Test
    @DisplayName("Should lift system turns and rename assistant to model")
    void mapsRoles() {
        // Given
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "test-key"))
                .andExpect(jsonPath("$.systemInstruction.parts[0].text").value("be brief"))
                .andExpect(jsonPath("$.contents.length()").value(3))
                .andExpect(jsonPath("$.contents[0].role").value("user"))
                .andExpect(jsonPath("$.contents[1].role").value("model"))
                .andExpect(jsonPath("$.contents[2].parts[0].text").value("and now?"))
                .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(256))
                .andRespond(withSuccess(
                        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hel\"},{\"text\":\"lo\"}]},"
                                + "\"finishReason\":\"STOP\"}]}",
                        MediaType.APPLICATION_JSON));

        // When
        String reply = provider.generate(List.of(
                ChatTurn.system("be brief"),
                ChatTurn.user("hi"),
                ChatTurn.assistant("hello"),
                ChatTurn.user("and now?")), new GenerationParams(0.2, 256));

        // Then
        assertThat(reply).isEqualTo("Hello");
        server.verify();
    }

    @Test
    @DisplayName("A blocked prompt should be reported as rejected")
    void blockedPrompt() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.generate(List.of(ChatTurn.user("x")), GenerationParams.defaults()))
                .isInstanceOf(BackendRejectedException.class);
    }

    @Test
    @DisplayName("An empty candidate stopped for safety should be reported as rejected")
    void safetyFinish() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.generate(List.of(ChatTurn.user("x")), GenerationParams.defaults()))
                .isInstanceOf(BackendRejectedException.class);
    }

    @Test
    @DisplayName("A non-2xx reply should be reported as unavailable")
    void httpErrorIsUnavailable() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("{\"error\":\"bad key\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.generate(List.of(ChatTurn.user("x")), GenerationParams.defaults()))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("403");
    }

    @Test
    @DisplayName("A missing API key should fail without a request")
    void missingKey() {
        GeminiGenerationProvider unconfigured = new GeminiGenerationProvider(new RestTemplate(),
                new ObjectMapper(), "http://gemini.test", " ", "gemini-1.5-flash");

        assertThat(unconfigured.isAvailable()).isFalse();
        assertThatThrownBy(() -> unconfigured.generate(List.of(ChatTurn.user("x")), GenerationParams.defaults()))
                .isInstanceOf(BackendUnavailableException.class);
    }
}

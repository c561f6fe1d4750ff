package com.groceryshopper.chat.service.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredOutputExtractorTest {

    private final StructuredOutputExtractor extractor = new StructuredOutputExtractor(new ObjectMapper());

    @Test
    @DisplayName("Should parse a bare JSON object")
    void parsesWholeText() {
        Map<String, Object> result = extractor.extract("{\"narrative\":\"ok\",\"items\":[1,2]}");

        assertThat(result).containsEntry("narrative", "ok");
        assertThat(result.get("items")).isEqualTo(List.of(1, 2));
    }

    @Test
    @DisplayName("Should recover an object surrounded by noise")
    void recoversEmbeddedObject() {
        assertThat(extractor.extract("noise {\"a\":1} trailing")).isEqualTo(Map.of("a", 1));
    }

    @Test
    @DisplayName("Should recover an object wrapped in a markdown fence")
    void recoversFencedObject() {
        String fenced = "Here you go:\n```json\n{\"goal\": \"BBQ party\"}\n```";

        assertThat(extractor.extract(fenced)).containsEntry("goal", "BBQ party");
    }

    @Test
    @DisplayName("Should return an empty map for text without JSON")
    void returnsEmptyForPlainText() {
        assertThat(extractor.extract("not json at all")).isEmpty();
    }

    @Test
    @DisplayName("Should return an empty map for broken JSON, arrays and null input")
    void neverThrows() {
        assertThat(extractor.extract("{\"a\": ")).isEmpty();
        assertThat(extractor.extract("} backwards {")).isEmpty();
        assertThat(extractor.extract("[1, 2, 3]")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }
}

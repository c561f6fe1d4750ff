package com.groceryshopper.chat.service.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Best-effort recovery of a JSON object from free model output.
 *
 * <p>Tries the whole text first, then the span from the first {@code '{'} to the last
 * {@code '}'}. Anything else yields an empty map; this method never throws.
 */
@Slf4j
@Component
public class StructuredOutputExtractor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StructuredOutputExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> extract(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyMap();
        }

        Map<String, Object> whole = tryParse(text.trim());
        if (whole != null) {
            return whole;
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            Map<String, Object> embedded = tryParse(text.substring(start, end + 1));
            if (embedded != null) {
                return embedded;
            }
        }

        log.debug("No JSON object recoverable from model output ({} chars)", text.length());
        return Collections.emptyMap();
    }

    private Map<String, Object> tryParse(String candidate) {
        try {
            return objectMapper.readValue(candidate, MAP_TYPE);
        } catch (JsonProcessingException | RuntimeException e) {
            return null;
        }
    }
}

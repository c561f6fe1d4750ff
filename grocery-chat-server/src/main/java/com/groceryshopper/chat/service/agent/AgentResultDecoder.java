package com.groceryshopper.chat.service.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.domain.InventoryAnalysis;
import com.groceryshopper.chat.domain.InventorySnapshot;
import com.groceryshopper.chat.domain.MenuSuggestion;
import com.groceryshopper.chat.domain.ProcurementPlan;
import com.groceryshopper.chat.domain.RestockPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns the loose maps recovered by {@link StructuredOutputExtractor} into typed agent results.
 * Missing or ill-typed fields fall back to defaults; list elements that cannot be mapped are skipped.
 */
@Slf4j
@Component
public class AgentResultDecoder {

    static final String ANALYSIS_DEFAULT_NARRATIVE = "Inventory analysis generated.";
    static final String RESTOCK_CALL_TO_ACTION = " If you need a restock plan, type '@gro restock'.";
    static final String PLAN_DEFAULT_SUMMARY = "Shopping list generated.";
    static final String PLAN_DEFAULT_NARRATIVE = "Here is your consolidated shopping plan.";

    private final ObjectMapper objectMapper;

    public AgentResultDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Low-stock and healthy lists always come from the snapshot, so the model cannot
     * reclassify items. Only the narrative is taken from the output.
     */
    public InventoryAnalysis decodeAnalysis(Map<String, Object> data, InventorySnapshot snapshot) {
        String narrative = text(data, "narrative", ANALYSIS_DEFAULT_NARRATIVE) + RESTOCK_CALL_TO_ACTION;
        return InventoryAnalysis.builder()
            .narrative(narrative)
            .lowStock(snapshot.getLowStock())
            .healthy(snapshot.getHealthy())
            .build();
    }

    /**
     * @param raw the unparsed output, used as the narrative when no object could be recovered
     */
    public MenuSuggestion decodeMenu(Map<String, Object> data, String raw) {
        return MenuSuggestion.builder()
            .narrative(text(data, "narrative", raw))
            .dishes(list(data.get("dishes"), MenuSuggestion.Dish.class))
            .build();
    }

    public RestockPlan decodeRestock(Map<String, Object> data, String raw) {
        return RestockPlan.builder()
            .narrative(text(data, "narrative", raw))
            .restockPlan(list(data.get("restock_plan"), RestockPlan.Line.class))
            .build();
    }

    public String decodeGoal(Map<String, Object> data) {
        return text(data, "goal", "");
    }

    public ProcurementPlan decodePlan(Map<String, Object> data, String inferredGoal) {
        return ProcurementPlan.builder()
            .goal(text(data, "goal", inferredGoal))
            .summary(text(data, "summary", PLAN_DEFAULT_SUMMARY))
            .narrative(text(data, "narrative", PLAN_DEFAULT_NARRATIVE))
            .items(list(data.get("items"), ProcurementPlan.Item.class))
            .build();
    }

    private String text(Map<String, Object> data, String key, String fallback) {
        Object value = data.get(key);
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        return fallback != null ? fallback : "";
    }

    private <T> List<T> list(Object value, Class<T> elementType) {
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<T> out = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof Map)) {
                continue;
            }
            try {
                out.add(objectMapper.convertValue(element, elementType));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping {} element that does not fit: {}", elementType.getSimpleName(), e.getMessage());
            }
        }
        return out;
    }
}

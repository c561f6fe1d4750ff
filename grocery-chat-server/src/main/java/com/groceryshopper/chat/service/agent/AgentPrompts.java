package com.groceryshopper.chat.service.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.domain.CatalogCandidate;
import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.InventorySnapshot;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the turn lists sent to the generation backend for each agent command.
 */
@Component
public class AgentPrompts {

    static final String MENTION_SYSTEM =
        "You are a helpful assistant participating in a small group chat. "
        + "Provide concise, accurate answers suitable for a shared chat context. "
        + "Cite facts succinctly when helpful and avoid extremely long messages.";

    static final String ANALYSIS_SYSTEM = """
        You are an Inventory Analyst.

        INPUT DATA:
        - "low_stock": items the user is running short of.
        - "grocery_items": catalog products that may match those items.

        TASK:
        1. Acknowledge the current inventory status.
        2. For each low_stock item, check "grocery_items" for matching products and mention
           in the narrative that they are available to order.
        3. Output STRICT JSON.

        OUTPUT FORMAT:
        {
            "narrative": "<summary including availability check>",
            "low_stock": [... echo input ...],
            "healthy": [... echo input ...]
        }

        RULES:
        - Do NOT change the stock numbers.
        - JSON ONLY.
        """;

    static final String MENU_SYSTEM = """
        You are an AI Chef for a restaurant.
        Suggest dishes that can be made with the given inventory. Catalog items may be
        proposed for missing ingredients.

        Output JSON ONLY:
        {
            "narrative": "<short explanation>",
            "dishes": [
                {
                    "name": "<dish name>",
                    "ingredients_used": ["tomatoes", "cheese"],
                    "missing_ingredients": ["basil"],
                    "suggested_suppliers_needed": ["basil"]
                }
            ]
        }
        """;

    static final String RESTOCK_SYSTEM = """
        You are an AI Procurement Planner for a restaurant.

        Given the low-stock inventory and a grocery catalog with price and category,
        create a weekly restock plan with suppliers.

        Output JSON ONLY:
        {
            "narrative": "<short explanation>",
            "restock_plan": [
                {
                    "product_name": "...",
                    "needed_qty": <int>,
                    "recommended_supplier": "<supplier name or link>",
                    "price_estimate": <float>
                }
            ]
        }
        """;

    static final String GOAL_SYSTEM = """
        You are an AI assistant. Identify the main event goal of the group from the chat history.

        The goal could be things like:
        - "BBQ party this Saturday"
        - "Friendsgiving dinner"
        - "Weekly grocery shopping"

        Output JSON ONLY:
        { "goal": "<string>" }

        If there is no clear goal, return:
        { "goal": "" }
        """;

    static final String PLAN_SYSTEM = """
        You are an intelligent AI Procurement Planner.
        Create a consolidated shopping list from the chat history.

        RULES:
        1. Conflict resolution: if one member asks for an item and another says it is already
           at hand or should not be bought, remove it.
        2. Quantity merging: "buy 2 apples" followed by "buy 3 more" becomes "5 apples".
        3. Categorization: give each item a category such as Produce, Dairy, Meat, Household.
        4. Filtering: ignore chit-chat. Only list items explicitly requested for purchase.

        OUTPUT FORMAT (STRICT JSON ONLY, no markdown fences):
        {
            "goal": "<the event or goal>",
            "summary": "<one sentence summary of the plan>",
            "narrative": "<friendly explanation of what was decided>",
            "items": [
                {
                    "name": "<item name>",
                    "quantity": "<e.g. '2 packs', '500g'>",
                    "category": "<e.g. 'Produce'>",
                    "notes": "<who asked for it, or brand mentioned>"
                }
            ]
        }
        """;

    /** Catalog rows handed to the restock prompt are capped. */
    static final int RESTOCK_CATALOG_SAMPLE = 30;

    private final ObjectMapper objectMapper;

    public AgentPrompts(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ChatTurn> mention(String question) {
        return List.of(ChatTurn.system(MENTION_SYSTEM), ChatTurn.user(question));
    }

    public List<ChatTurn> analysis(InventorySnapshot snapshot, List<CatalogCandidate> candidates) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inventory_items", snapshot.getAll());
        payload.put("low_stock", snapshot.getLowStock());
        payload.put("healthy", snapshot.getHealthy());
        payload.put("grocery_items", candidates);
        return List.of(ChatTurn.system(ANALYSIS_SYSTEM), ChatTurn.user(toJson(payload)));
    }

    public List<ChatTurn> menu(InventorySnapshot snapshot, List<CatalogCandidate> candidates) {
        String user = "Available ingredients:\n" + toJson(snapshot.getAll())
            + "\nCatalog items:\n" + toJson(candidates)
            + "\nGenerate possible dishes.";
        return List.of(ChatTurn.system(MENU_SYSTEM), ChatTurn.user(user));
    }

    public List<ChatTurn> restock(InventorySnapshot snapshot, List<CatalogCandidate> candidates) {
        List<CatalogCandidate> sample = candidates.size() > RESTOCK_CATALOG_SAMPLE
            ? candidates.subList(0, RESTOCK_CATALOG_SAMPLE)
            : candidates;
        String user = "Low-stock inventory: " + toJson(snapshot.getLowStock())
            + "\n\nGrocery catalog sample: " + toJson(sample)
            + "\n\nCreate a weekly restock plan with suppliers.";
        return List.of(ChatTurn.system(RESTOCK_SYSTEM), ChatTurn.user(user));
    }

    public List<ChatTurn> goal(String chatHistory) {
        return List.of(ChatTurn.system(GOAL_SYSTEM),
            ChatTurn.user("Chat history:\n" + chatHistory + "\n\nExtract the goal in JSON."));
    }

    public List<ChatTurn> procurementPlan(String chatHistory, String inferredGoal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("inferred_goal", inferredGoal);
        payload.put("chat_history_text", chatHistory);
        return List.of(ChatTurn.system(PLAN_SYSTEM), ChatTurn.user(toJson(payload)));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Prompt payload not serializable", e);
        }
    }
}

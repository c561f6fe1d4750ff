package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MenuSuggestion implements AgentResult {

    private String narrative;

    private List<Dish> dishes;

    @Override
    public AgentEventKind kind() {
        return AgentEventKind.MENU;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dish {
        private String name;

        @JsonProperty("ingredients_used")
        @JsonAlias("ingrdients_used")
        private List<String> ingredientsUsed;

        @JsonProperty("missing_ingredients")
        private List<String> missingIngredients;

        @JsonProperty("suggested_suppliers_needed")
        private List<String> suggestedSuppliersNeeded;
    }
}

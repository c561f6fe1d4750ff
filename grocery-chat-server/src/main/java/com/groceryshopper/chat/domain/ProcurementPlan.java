package com.groceryshopper.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcurementPlan implements AgentResult {

    private String goal;

    private String summary;

    private String narrative;

    private List<Item> items;

    @Override
    public AgentEventKind kind() {
        return AgentEventKind.PROCUREMENT_PLAN;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String name;
        private String quantity;
        private String category;
        private String notes;
    }
}

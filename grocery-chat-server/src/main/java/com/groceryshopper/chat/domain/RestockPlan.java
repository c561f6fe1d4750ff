package com.groceryshopper.chat.domain;

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
public class RestockPlan implements AgentResult {

    private String narrative;

    @JsonProperty("restock_plan")
    private List<Line> restockPlan;

    @Override
    public AgentEventKind kind() {
        return AgentEventKind.RESTOCK;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        @JsonProperty("product_name")
        private String productName;

        @JsonProperty("needed_qty")
        private Integer neededQty;

        @JsonProperty("recommended_supplier")
        private String recommendedSupplier;

        @JsonProperty("price_estimate")
        private Double priceEstimate;
    }
}

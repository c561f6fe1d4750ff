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
public class InventoryAnalysis implements AgentResult {

    private String narrative;

    @JsonProperty("low_stock")
    private List<InventorySnapshotItem> lowStock;

    private List<InventorySnapshotItem> healthy;

    @Override
    public AgentEventKind kind() {
        return AgentEventKind.ANALYSIS;
    }
}

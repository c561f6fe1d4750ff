package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventorySnapshotItem {

    @JsonProperty("product_name")
    private String productName;

    private int stock;

    @JsonProperty("safety_stock_level")
    private int safetyStockLevel;

    public static InventorySnapshotItem from(InventoryItem item) {
        return new InventorySnapshotItem(item.getProductName(), item.getStock(), item.getSafetyStockLevel());
    }
}

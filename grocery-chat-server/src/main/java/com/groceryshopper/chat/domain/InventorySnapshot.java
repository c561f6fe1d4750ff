package com.groceryshopper.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A user's inventory split into low-stock ({@code stock < safety}) and healthy items.
 */
@Data
@AllArgsConstructor
public class InventorySnapshot {

    private final List<InventorySnapshotItem> all;
    private final List<InventorySnapshotItem> lowStock;
    private final List<InventorySnapshotItem> healthy;

    public static InventorySnapshot of(List<InventoryItem> items) {
        List<InventorySnapshotItem> all = new ArrayList<>();
        List<InventorySnapshotItem> low = new ArrayList<>();
        List<InventorySnapshotItem> healthy = new ArrayList<>();
        for (InventoryItem item : items) {
            InventorySnapshotItem view = InventorySnapshotItem.from(item);
            all.add(view);
            if (item.isLowStock()) {
                low.add(view);
            } else {
                healthy.add(view);
            }
        }
        return new InventorySnapshot(all, low, healthy);
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    public List<String> lowStockNames() {
        return lowStock.stream().map(InventorySnapshotItem::getProductName).toList();
    }

    public List<String> allNames() {
        return all.stream().map(InventorySnapshotItem::getProductName).toList();
    }
}

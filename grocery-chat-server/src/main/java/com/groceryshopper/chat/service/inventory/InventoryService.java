package com.groceryshopper.chat.service.inventory;

import com.groceryshopper.chat.domain.InventorySnapshot;
import com.groceryshopper.chat.repository.InventoryItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Slf4j
public class InventoryService {

    private final InventoryItemRepository inventoryItemRepository;

    public InventoryService(InventoryItemRepository inventoryItemRepository) {
        this.inventoryItemRepository = inventoryItemRepository;
    }

    /**
     * Insert or overwrite the line keyed by (user, product name). Concurrent writers of the
     * same new product resolve on the unique key inside one statement; the last write wins.
     */
    @Transactional
    public void upsert(Long userId, String productName, int stock, int safetyStockLevel) {
        int affected = inventoryItemRepository.upsertLine(userId, productName, stock, safetyStockLevel);
        log.debug("Inventory upserted: userId={}, product={}, stock={}, safety={}, affected={}",
            userId, productName, stock, safetyStockLevel, affected);
    }

    @Transactional(readOnly = true)
    public InventorySnapshot snapshot(Long userId) {
        return InventorySnapshot.of(inventoryItemRepository.findByUserIdOrderByProductNameAsc(userId));
    }
}

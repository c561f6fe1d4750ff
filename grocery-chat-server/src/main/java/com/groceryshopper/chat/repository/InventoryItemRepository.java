package com.groceryshopper.chat.repository;

import com.groceryshopper.chat.domain.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    List<InventoryItem> findByUserIdOrderByProductNameAsc(Long userId);

    /**
     * Single-statement insert-or-overwrite on the (user_id, product_name) unique key.
     * Returns the MySQL affected-row count: 1 inserted, 2 updated, 0 unchanged.
     */
    @Modifying
    @Query(value = "INSERT INTO inventory (user_id, product_name, stock, safety_stock_level, created_at, updated_at) " +
            "VALUES (:userId, :productName, :stock, :safetyStockLevel, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON DUPLICATE KEY UPDATE stock = :stock, safety_stock_level = :safetyStockLevel, " +
            "updated_at = CURRENT_TIMESTAMP",
            nativeQuery = true)
    int upsertLine(@Param("userId") Long userId,
                   @Param("productName") String productName,
                   @Param("stock") int stock,
                   @Param("safetyStockLevel") int safetyStockLevel);
}

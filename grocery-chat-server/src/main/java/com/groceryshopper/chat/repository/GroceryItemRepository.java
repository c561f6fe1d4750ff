package com.groceryshopper.chat.repository;

import com.groceryshopper.chat.domain.GroceryItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Catalog lookups backing the three matching tiers of the catalog search.
 */
@Repository
public interface GroceryItemRepository extends JpaRepository<GroceryItem, Long> {

    List<GroceryItem> findByTitleContainingIgnoreCase(String term, Pageable pageable);

    List<GroceryItem> findBySubCategoryContainingIgnoreCase(String term, Pageable pageable);

    @Query("SELECT g FROM GroceryItem g ORDER BY g.ratingValue DESC NULLS LAST, g.id ASC")
    List<GroceryItem> findTopRated(Pageable pageable);
}

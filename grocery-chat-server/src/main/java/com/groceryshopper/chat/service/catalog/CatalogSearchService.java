package com.groceryshopper.chat.service.catalog;

import com.groceryshopper.chat.domain.CatalogCandidate;
import com.groceryshopper.chat.domain.GroceryItem;
import com.groceryshopper.chat.repository.GroceryItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;

/**
 * Catalog lookup over {@code grocery_items}: title match, then category match, then the
 * highest-rated items when neither matches.
 */
@Service
@Slf4j
public class CatalogSearchService {

    private final GroceryItemRepository groceryItemRepository;

    public CatalogSearchService(GroceryItemRepository groceryItemRepository) {
        this.groceryItemRepository = groceryItemRepository;
    }

    @Transactional(readOnly = true)
    public List<CatalogCandidate> search(String term, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        PageRequest page = PageRequest.of(0, limit);
        String trimmed = term == null ? "" : term.trim();

        List<GroceryItem> hits = Collections.emptyList();
        if (!trimmed.isEmpty()) {
            hits = groceryItemRepository.findByTitleContainingIgnoreCase(trimmed, page);
            if (hits.isEmpty()) {
                hits = groceryItemRepository.findBySubCategoryContainingIgnoreCase(trimmed, page);
            }
        }
        if (hits.isEmpty()) {
            log.debug("No catalog match for '{}', using top-rated items", trimmed);
            hits = groceryItemRepository.findTopRated(page);
        }
        return hits.stream().map(CatalogCandidate::from).toList();
    }
}

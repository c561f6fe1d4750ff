package com.groceryshopper.chat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Read-only projection of a catalog hit, handed to prompts and then discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogCandidate {

    private String title;
    private String category;
    private BigDecimal price;
    private Float rating;

    public static CatalogCandidate from(GroceryItem item) {
        return CatalogCandidate.builder()
            .title(item.getTitle())
            .category(item.getSubCategory())
            .price(item.getPrice())
            .rating(item.getRatingValue())
            .build();
    }
}

package com.groceryshopper.chat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Catalog row imported offline from the grocery dataset. Read-only here.
 */
@Entity
@Table(name = "grocery_items", indexes = {
    @Index(name = "idx_title", columnList = "title"),
    @Index(name = "idx_sub_category", columnList = "sub_category")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroceryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(columnDefinition = "INT")
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(name = "sub_category", nullable = false, length = 120)
    private String subCategory;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "rating_value")
    private Float ratingValue;

    @Column(name = "rating_count")
    private Integer ratingCount;
}

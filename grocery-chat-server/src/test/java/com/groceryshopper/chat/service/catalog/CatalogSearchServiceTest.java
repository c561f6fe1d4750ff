package com.groceryshopper.chat.service.catalog;

import com.groceryshopper.chat.domain.CatalogCandidate;
import com.groceryshopper.chat.domain.GroceryItem;
import com.groceryshopper.chat.repository.GroceryItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogSearchServiceTest {

    @Mock
    private GroceryItemRepository groceryItemRepository;

    private CatalogSearchService service;

    @BeforeEach
    void setUp() {
        service = new CatalogSearchService(groceryItemRepository);
    }

    private static GroceryItem grocery(String title, String category) {
        return GroceryItem.builder().id(1L).title(title).subCategory(category).build();
    }

    @Test
    @DisplayName("Should use title matches when there are any")
    void titleMatchFirst() {
        when(groceryItemRepository.findByTitleContainingIgnoreCase(eq("tomato"), any(Pageable.class)))
                .thenReturn(List.of(grocery("Cherry Tomatoes", "Vegetables")));

        List<CatalogCandidate> result = service.search("tomato", 5);

        assertThat(result).extracting(CatalogCandidate::getTitle).containsExactly("Cherry Tomatoes");
        verify(groceryItemRepository, never()).findBySubCategoryContainingIgnoreCase(any(), any());
        verify(groceryItemRepository, never()).findTopRated(any());
    }

    @Test
    @DisplayName("Should fall back to category matches")
    void categoryFallback() {
        when(groceryItemRepository.findByTitleContainingIgnoreCase(eq("dairy"), any(Pageable.class)))
                .thenReturn(List.of());
        when(groceryItemRepository.findBySubCategoryContainingIgnoreCase(eq("dairy"), any(Pageable.class)))
                .thenReturn(List.of(grocery("Greek Yogurt", "Dairy")));

        List<CatalogCandidate> result = service.search("dairy", 5);

        assertThat(result).extracting(CatalogCandidate::getCategory).containsExactly("Dairy");
    }

    @Test
    @DisplayName("Should fall back to top-rated items when nothing matches")
    void topRatedFallback() {
        when(groceryItemRepository.findByTitleContainingIgnoreCase(eq("zzz"), any(Pageable.class)))
                .thenReturn(List.of());
        when(groceryItemRepository.findBySubCategoryContainingIgnoreCase(eq("zzz"), any(Pageable.class)))
                .thenReturn(List.of());
        when(groceryItemRepository.findTopRated(any(Pageable.class)))
                .thenReturn(List.of(grocery("Sourdough Bread", "Bakery")));

        assertThat(service.search("zzz", 5)).hasSize(1);
    }

    @Test
    @DisplayName("Should return nothing for a non-positive limit")
    void zeroLimit() {
        assertThat(service.search("milk", 0)).isEmpty();
        verifyNoInteractions(groceryItemRepository);
    }
}

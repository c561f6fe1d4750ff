package com.groceryshopper.chat.service.catalog;

import com.groceryshopper.chat.domain.CatalogCandidate;
import com.groceryshopper.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pipeline-facing wrapper around {@link CatalogSearchService}.
 * A failed lookup counts as zero candidates for that term; nothing is retried.
 */
@Component
@Slf4j
public class RetrievalAdapter {

    private final CatalogSearchService catalogSearchService;
    private final MetricsService metricsService;
    private final int limitPerTerm;

    public RetrievalAdapter(CatalogSearchService catalogSearchService,
                            MetricsService metricsService,
                            @Value("${agent.retrieval.limit-per-term:20}") int limitPerTerm) {
        this.catalogSearchService = catalogSearchService;
        this.metricsService = metricsService;
        this.limitPerTerm = limitPerTerm;
    }

    public List<CatalogCandidate> findRelated(String term, int limit) {
        try {
            List<CatalogCandidate> found = catalogSearchService.search(term, limit);
            return found != null ? found : Collections.emptyList();
        } catch (RuntimeException e) {
            log.warn("Catalog lookup failed: term='{}', error={}", term, e.getMessage());
            metricsService.recordError("CATALOG_LOOKUP", "RetrievalAdapter");
            return Collections.emptyList();
        }
    }

    /**
     * One lookup per distinct term, merged and de-duplicated by title in first-seen order
     */
    public List<CatalogCandidate> findRelatedToAll(Collection<String> terms) {
        Set<String> distinct = new LinkedHashSet<>(terms);
        Map<String, CatalogCandidate> byTitle = new LinkedHashMap<>();
        for (String term : distinct) {
            for (CatalogCandidate candidate : findRelated(term, limitPerTerm)) {
                byTitle.putIfAbsent(candidate.getTitle(), candidate);
            }
        }
        log.debug("Retrieved {} distinct candidates for {} terms", byTitle.size(), distinct.size());
        return new ArrayList<>(byTitle.values());
    }
}

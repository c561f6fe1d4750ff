package com.groceryshopper.chat.service.generation;

import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.GenerationParams;
import com.groceryshopper.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single entry point for text generation. Routes a request to the adapter registered under
 * the backend id and normalizes failures:
 * <ul>
 *   <li>blocked content becomes {@link #BLOCKED_SENTINEL}</li>
 *   <li>anything else that goes wrong inside an adapter becomes {@link BackendUnavailableException}</li>
 *   <li>an unregistered id raises {@link UnknownBackendException}</li>
 * </ul>
 */
@Service
@Slf4j
public class GenerationService {

    public static final String BLOCKED_SENTINEL =
            "(The assistant's reply was blocked by the model's safety filter.)";

    private final Map<String, GenerationProvider> providers = new LinkedHashMap<>();
    private final MetricsService metricsService;
    private final GenerationParams defaultParams;

    public GenerationService(List<GenerationProvider> providers,
                             MetricsService metricsService,
                             @Value("${agent.generation.temperature:0.2}") double temperature,
                             @Value("${agent.generation.max-tokens:512}") int maxTokens) {
        for (GenerationProvider provider : providers) {
            GenerationProvider previous = this.providers.put(provider.backendId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate generation backend id: " + provider.backendId());
            }
        }
        this.metricsService = metricsService;
        this.defaultParams = new GenerationParams(temperature, maxTokens);

        log.info("GenerationService initialized with backends: {}", this.providers.keySet());
    }

    public String generate(List<ChatTurn> turns, String backendId) {
        return generate(turns, backendId, defaultParams);
    }

    public String generate(List<ChatTurn> turns, String backendId, GenerationParams params) {
        GenerationProvider provider = providers.get(backendId);
        if (provider == null) {
            log.error("CONFIGURATION ERROR: no generation backend registered under '{}', registered={}",
                    backendId, providers.keySet());
            metricsService.recordError("UNKNOWN_BACKEND", "GenerationService");
            throw new UnknownBackendException(backendId, providers.keySet());
        }

        long start = System.currentTimeMillis();
        try {
            String text = provider.generate(turns, params);
            metricsService.recordGenerationCall(backendId, true);
            log.debug("Generation completed: backend={}, turns={}, latency={}ms",
                    backendId, turns.size(), System.currentTimeMillis() - start);
            return text != null ? text : "";

        } catch (BackendRejectedException e) {
            metricsService.recordGenerationCall(backendId, false);
            log.warn("Generation blocked: backend={}, reason={}", backendId, e.getMessage());
            return BLOCKED_SENTINEL;

        } catch (BackendUnavailableException e) {
            metricsService.recordGenerationCall(backendId, false);
            log.warn("Generation backend unavailable: backend={}, error={}", backendId, e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            metricsService.recordGenerationCall(backendId, false);
            log.warn("Generation failed: backend={}, error={}", backendId, e.getMessage());
            throw new BackendUnavailableException(backendId, backendId + " call failed: " + e.getMessage(), e);
        }
    }

    public boolean isRegistered(String backendId) {
        return backendId != null && providers.containsKey(backendId);
    }

    public Set<String> getBackendIds() {
        return Collections.unmodifiableSet(providers.keySet());
    }

    public Optional<GenerationProvider> getProvider(String backendId) {
        return Optional.ofNullable(providers.get(backendId));
    }

    /**
     * Availability of every registered backend, in registration order
     */
    public Map<String, Boolean> checkAvailability() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        providers.forEach((id, provider) -> {
            boolean available;
            try {
                available = provider.isAvailable();
            } catch (RuntimeException e) {
                log.warn("Availability check failed: backend={}, error={}", id, e.getMessage());
                available = false;
            }
            status.put(id, available);
        });
        return status;
    }
}

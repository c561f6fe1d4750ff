package com.groceryshopper.chat.service;

import com.groceryshopper.chat.domain.UserAccount;
import com.groceryshopper.chat.repository.UserAccountRepository;
import com.groceryshopper.chat.service.generation.GeminiGenerationProvider;
import com.groceryshopper.chat.service.generation.GenerationProvider;
import com.groceryshopper.chat.service.generation.GenerationService;
import com.groceryshopper.chat.service.generation.OllamaGenerationProvider;
import com.groceryshopper.chat.service.generation.OpenAiGenerationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-user generation backend preference.
 */
@Service
@Slf4j
public class ModelPreferenceService {

    private static final Set<String> MOBILE_PLATFORMS = Set.of("ios", "android");

    private final UserAccountRepository userAccountRepository;
    private final GenerationService generationService;
    private final String defaultBackend;

    public ModelPreferenceService(UserAccountRepository userAccountRepository,
                                  GenerationService generationService,
                                  @Value("${agent.generation.default-backend:openai}") String defaultBackend) {
        this.userAccountRepository = userAccountRepository;
        this.generationService = generationService;
        this.defaultBackend = defaultBackend;
    }

    /**
     * Stored preference when it names a registered backend, otherwise the configured default
     */
    public String resolveBackend(Long userId) {
        if (userId == null) {
            return defaultBackend;
        }
        String preferred = userAccountRepository.findById(userId)
            .map(UserAccount::getPreferredLlmModel)
            .orElse(null);
        if (generationService.isRegistered(preferred)) {
            return preferred;
        }
        if (preferred != null && !preferred.isBlank()) {
            log.warn("Stored backend '{}' for userId={} is not registered, using default '{}'",
                preferred, userId, defaultBackend);
        }
        return defaultBackend;
    }

    /**
     * Current preference and the backends offered on the given platform.
     * Mobile clients never get the local backend.
     */
    public Map<String, Object> describe(String username, String platform) {
        UserAccount user = requireUser(username);
        String normalizedPlatform = platform == null ? "desktop" : platform.toLowerCase(Locale.ROOT);
        boolean mobile = MOBILE_PLATFORMS.contains(normalizedPlatform);

        Map<String, Boolean> availability = generationService.checkAvailability();
        List<String> offered = new ArrayList<>();
        availability.forEach((id, available) -> {
            if (mobile && OllamaGenerationProvider.BACKEND_ID.equals(id)) {
                return;
            }
            if (available || id.equals(defaultBackend)) {
                offered.add(id);
            }
        });

        String current = user.getPreferredLlmModel();
        if (mobile && OllamaGenerationProvider.BACKEND_ID.equals(current)) {
            current = OpenAiGenerationProvider.BACKEND_ID;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("model", current);
        response.put("available_models", offered);
        response.put("tinyllama_available",
            !mobile && availability.getOrDefault(OllamaGenerationProvider.BACKEND_ID, false));
        response.put("gemini_available", availability.getOrDefault(GeminiGenerationProvider.BACKEND_ID, false));
        response.put("platform", normalizedPlatform);
        return response;
    }

    /**
     * Validate and store a preference.
     *
     * @throws ChatAccessException 400 when the backend is unknown or not usable, 401 for an unknown user
     */
    public String update(String username, String model) {
        if (model == null || model.isBlank()) {
            throw new ChatAccessException(HttpStatus.BAD_REQUEST, "model is required");
        }
        GenerationProvider provider = generationService.getProvider(model)
            .orElseThrow(() -> new ChatAccessException(HttpStatus.BAD_REQUEST,
                "Invalid model. Choose from: " + generationService.getBackendIds()));

        UserAccount user = requireUser(username);

        if (!provider.isAvailable()) {
            throw new ChatAccessException(HttpStatus.BAD_REQUEST, unavailableDetail(model));
        }

        userAccountRepository.updatePreferredModel(user.getId(), model);
        log.info("Backend preference updated: userId={}, model={}", user.getId(), model);
        return model;
    }

    private String unavailableDetail(String model) {
        if (OllamaGenerationProvider.BACKEND_ID.equals(model)) {
            return model + " model not found. Download it first with POST /api/models/download-tinyllama";
        }
        return model + " model not available. Configure its API key on the server";
    }

    private UserAccount requireUser(String username) {
        return userAccountRepository.findByUsername(username)
            .orElseThrow(() -> new ChatAccessException(HttpStatus.UNAUTHORIZED, "Invalid user"));
    }
}

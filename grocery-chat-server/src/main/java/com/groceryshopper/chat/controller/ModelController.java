package com.groceryshopper.chat.controller;

import com.groceryshopper.chat.service.ChatAccessException;
import com.groceryshopper.chat.service.ModelDownloadService;
import com.groceryshopper.chat.service.ModelPreferenceService;
import com.groceryshopper.chat.service.SecurityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Generation backend preference and local model download.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ModelController {

    private final ModelPreferenceService modelPreferenceService;
    private final ModelDownloadService modelDownloadService;
    private final SecurityValidator securityValidator;

    public ModelController(ModelPreferenceService modelPreferenceService,
                           ModelDownloadService modelDownloadService,
                           SecurityValidator securityValidator) {
        this.modelPreferenceService = modelPreferenceService;
        this.modelDownloadService = modelDownloadService;
        this.securityValidator = securityValidator;
    }

    /**
     * GET /api/users/llm-model?platform=desktop
     */
    @GetMapping("/users/llm-model")
    public ResponseEntity<?> getModel(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestParam(defaultValue = "desktop") String platform) {
        try {
            String username = securityValidator.authenticate(authorization);
            return ResponseEntity.ok(modelPreferenceService.describe(username, platform));
        } catch (ChatAccessException e) {
            return error(e);
        } catch (Exception e) {
            log.error("Error reading model preference", e);
            return internalError(e);
        }
    }

    /**
     * PUT /api/users/llm-model {"model": "openai"}
     */
    @PutMapping("/users/llm-model")
    public ResponseEntity<?> updateModel(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @RequestBody Map<String, Object> request) {
        try {
            String username = securityValidator.authenticate(authorization);
            Object model = request.get("model");
            String stored = modelPreferenceService.update(username, model instanceof String ? (String) model : null);
            return ResponseEntity.ok(Map.of("ok", true, "model", stored));
        } catch (ChatAccessException e) {
            log.warn("Model preference rejected: status={}, reason={}", e.getStatus(), e.getMessage());
            return error(e);
        } catch (Exception e) {
            log.error("Error updating model preference", e);
            return internalError(e);
        }
    }

    /**
     * POST /api/models/download-tinyllama
     */
    @PostMapping("/models/download-tinyllama")
    public ResponseEntity<?> downloadLocalModel(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        try {
            securityValidator.authenticate(authorization);
            ModelDownloadService.StartOutcome outcome = modelDownloadService.startDownload();
            String message = switch (outcome) {
                case STARTED -> "Download started";
                case ALREADY_DOWNLOADING -> "Download already in progress";
                case ALREADY_INSTALLED -> "Model is already downloaded";
            };
            return ResponseEntity.ok(Map.of(
                    "ok", true,
                    "status", outcome.name().toLowerCase(),
                    "message", message));
        } catch (ChatAccessException e) {
            return error(e);
        } catch (TaskRejectedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "error", "Download could not be started",
                    "detail", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            log.error("Error starting model download", e);
            return internalError(e);
        }
    }

    /**
     * GET /api/models/download-progress
     */
    @GetMapping("/models/download-progress")
    public ResponseEntity<?> downloadProgress(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        try {
            securityValidator.authenticate(authorization);
            return ResponseEntity.ok(modelDownloadService.getProgress());
        } catch (ChatAccessException e) {
            return error(e);
        }
    }

    private ResponseEntity<?> error(ChatAccessException e) {
        return ResponseEntity.status(e.getStatus()).body(Map.of(
                "error", e.getStatus().getReasonPhrase(),
                "detail", e.getMessage()));
    }

    private ResponseEntity<?> internalError(Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "Internal server error",
                "detail", String.valueOf(e.getMessage())));
    }
}

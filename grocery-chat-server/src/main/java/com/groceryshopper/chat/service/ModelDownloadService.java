package com.groceryshopper.chat.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryshopper.chat.domain.DownloadProgress;
import com.groceryshopper.chat.service.generation.OllamaGenerationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Pulls the local model through Ollama in the background and tracks progress.
 * At most one pull runs at a time; progress is read through {@link #getProgress()}.
 */
@Service
@Slf4j
public class ModelDownloadService {

    public enum StartOutcome {
        STARTED, ALREADY_INSTALLED, ALREADY_DOWNLOADING
    }

    private final OllamaGenerationProvider ollama;
    private final TaskExecutor downloadExecutor;
    private final MetricsService metricsService;
    private final AtomicReference<DownloadProgress> progress = new AtomicReference<>(DownloadProgress.idle());

    public ModelDownloadService(OllamaGenerationProvider ollama,
                                @Qualifier("modelDownloadExecutor") TaskExecutor downloadExecutor,
                                MetricsService metricsService) {
        this.ollama = ollama;
        this.downloadExecutor = downloadExecutor;
        this.metricsService = metricsService;
    }

    public DownloadProgress getProgress() {
        return progress.get();
    }

    public StartOutcome startDownload() {
        DownloadProgress current = progress.get();
        if (current.getStatus() == DownloadProgress.Status.DOWNLOADING) {
            return StartOutcome.ALREADY_DOWNLOADING;
        }
        if (ollama.isAvailable()) {
            progress.set(new DownloadProgress(DownloadProgress.Status.COMPLETED, 100,
                ollama.getModel() + " is already downloaded"));
            return StartOutcome.ALREADY_INSTALLED;
        }

        DownloadProgress starting = new DownloadProgress(DownloadProgress.Status.DOWNLOADING, 0,
            "Starting download of " + ollama.getModel());
        if (!progress.compareAndSet(current, starting)) {
            return StartOutcome.ALREADY_DOWNLOADING;
        }

        try {
            downloadExecutor.execute(this::runPull);
        } catch (TaskRejectedException e) {
            log.error("Model download could not be scheduled", e);
            progress.set(new DownloadProgress(DownloadProgress.Status.FAILED, 0, "Download could not be started"));
            throw e;
        }
        log.info("Model download started: model={}", ollama.getModel());
        return StartOutcome.STARTED;
    }

    void runPull() {
        try {
            ollama.pullModel(this::onStatus);
            progress.set(new DownloadProgress(DownloadProgress.Status.COMPLETED, 100,
                ollama.getModel() + " downloaded successfully"));
            metricsService.incrementCounter("model.download.success");
            log.info("Model download completed: model={}", ollama.getModel());
        } catch (RuntimeException e) {
            progress.set(new DownloadProgress(DownloadProgress.Status.FAILED,
                progress.get().getProgress(), "Download failed: " + e.getMessage()));
            metricsService.recordError("MODEL_DOWNLOAD", "ModelDownloadService");
            log.warn("Model download failed: model={}, error={}", ollama.getModel(), e.getMessage());
        }
    }

    /**
     * One NDJSON status line from the pull. Byte counts, when present, drive the percentage.
     */
    void onStatus(JsonNode status) {
        String text = status.path("status").asText("");
        int percent = progress.get().getProgress();
        long total = status.path("total").asLong(0);
        long completed = status.path("completed").asLong(0);
        if (total > 0) {
            percent = (int) Math.min(99, completed * 100 / total);
        }
        progress.set(new DownloadProgress(DownloadProgress.Status.DOWNLOADING, percent, text));
    }
}

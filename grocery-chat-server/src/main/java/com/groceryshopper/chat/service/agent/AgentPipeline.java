package com.groceryshopper.chat.service.agent;

import com.groceryshopper.chat.domain.AgentResult;
import com.groceryshopper.chat.domain.CatalogCandidate;
import com.groceryshopper.chat.domain.ChatMessage;
import com.groceryshopper.chat.domain.InventoryAnalysis;
import com.groceryshopper.chat.domain.InventorySnapshot;
import com.groceryshopper.chat.domain.MenuSuggestion;
import com.groceryshopper.chat.domain.PipelineRequest;
import com.groceryshopper.chat.domain.ProcurementPlan;
import com.groceryshopper.chat.domain.RestockPlan;
import com.groceryshopper.chat.service.EventPublisher;
import com.groceryshopper.chat.service.MetricsService;
import com.groceryshopper.chat.service.ModelPreferenceService;
import com.groceryshopper.chat.service.RoomMessageService;
import com.groceryshopper.chat.service.catalog.RetrievalAdapter;
import com.groceryshopper.chat.service.generation.GenerationException;
import com.groceryshopper.chat.service.generation.GenerationService;
import com.groceryshopper.chat.service.generation.UnknownBackendException;
import com.groceryshopper.chat.service.inventory.InventoryIngestionHandler;
import com.groceryshopper.chat.service.inventory.InventoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a stored chat message to the matching agent command and emits the outcome to the room.
 *
 * <p>{@link #dispatch} hands the work to the bounded {@code agentPipelineExecutor} and returns
 * immediately. Inside a run, every failure is caught at the task boundary and turned into an
 * agent message: generation failures are prefixed with {@link #ERROR_PREFIX}, anything else
 * (storage, ingestion) with {@link #AGENT_ERROR_PREFIX}. Typed events are broadcast before their
 * confirmation message.
 */
@Service
@Slf4j
public class AgentPipeline {

    public static final String ERROR_PREFIX = "(LLM error) ";
    public static final String AGENT_ERROR_PREFIX = "(Agent error) ";

    static final String BUSY_REPLY = "I'm busy with other requests right now. Please try again in a moment.";
    static final String EMPTY_INVENTORY_REPLY = "Your inventory is empty. Add items with @inventory first.";
    static final String NOTHING_TO_RESTOCK_REPLY = "All items are at or above their safety stock. Nothing to restock.";
    static final String EMPTY_MENTION_REPLY =
        "Ask me something after @gro, or try @gro analyze, @gro menu, @gro restock or @gro plan.";
    static final String ANALYSIS_READY = "Inventory analysis is ready.";
    static final String MENU_READY = "Menu suggestions are ready.";
    static final String RESTOCK_READY = "Restock plan is ready.";

    private final CommandClassifier classifier;
    private final InventoryIngestionHandler ingestionHandler;
    private final InventoryService inventoryService;
    private final RetrievalAdapter retrievalAdapter;
    private final GenerationService generationService;
    private final StructuredOutputExtractor extractor;
    private final AgentResultDecoder decoder;
    private final AgentPrompts prompts;
    private final ModelPreferenceService modelPreferenceService;
    private final RoomMessageService roomMessageService;
    private final MetricsService metricsService;
    private final TaskExecutor pipelineExecutor;
    private final int historyLimit;

    // Optional: Kafka audit publisher (null if Kafka is disabled)
    private final EventPublisher eventPublisher;

    public AgentPipeline(CommandClassifier classifier,
                         InventoryIngestionHandler ingestionHandler,
                         InventoryService inventoryService,
                         RetrievalAdapter retrievalAdapter,
                         GenerationService generationService,
                         StructuredOutputExtractor extractor,
                         AgentResultDecoder decoder,
                         AgentPrompts prompts,
                         ModelPreferenceService modelPreferenceService,
                         RoomMessageService roomMessageService,
                         MetricsService metricsService,
                         @Qualifier("agentPipelineExecutor") TaskExecutor pipelineExecutor,
                         @Value("${agent.history.limit:50}") int historyLimit,
                         @Autowired(required = false) EventPublisher eventPublisher) {
        this.classifier = classifier;
        this.ingestionHandler = ingestionHandler;
        this.inventoryService = inventoryService;
        this.retrievalAdapter = retrievalAdapter;
        this.generationService = generationService;
        this.extractor = extractor;
        this.decoder = decoder;
        this.prompts = prompts;
        this.modelPreferenceService = modelPreferenceService;
        this.roomMessageService = roomMessageService;
        this.metricsService = metricsService;
        this.pipelineExecutor = pipelineExecutor;
        this.historyLimit = historyLimit;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Fire-and-forget. Messages without a trigger never reach the pool.
     */
    public void dispatch(PipelineRequest request) {
        AgentCommand command = classifier.classify(request.getContent());
        if (!command.isTriggered()) {
            return;
        }
        try {
            pipelineExecutor.execute(() -> process(request));
        } catch (TaskRejectedException e) {
            log.warn("Pipeline pool saturated, rejecting: roomId={}, command={}", request.getRoomId(), command);
            metricsService.recordError("PIPELINE_REJECTED", "AgentPipeline");
            postSafely(request.getRoomId(), BUSY_REPLY);
        }
    }

    /**
     * Run one message through the router on the calling thread
     */
    public void process(PipelineRequest request) {
        AgentCommand command = classifier.classify(request.getContent());
        if (!command.isTriggered()) {
            return;
        }

        long start = System.currentTimeMillis();
        boolean success = false;
        log.info("Pipeline started: roomId={}, userId={}, command={}",
            request.getRoomId(), request.getUserId(), command);
        try {
            switch (command) {
                case INVENTORY -> handleInventory(request);
                case ANALYZE -> handleAnalysis(request);
                case MENU -> handleMenu(request);
                case RESTOCK -> handleRestock(request);
                case PLAN -> handlePlan(request);
                case MENTION -> handleMention(request);
                default -> throw new IllegalStateException("Unhandled command " + command);
            }
            success = true;

        } catch (UnknownBackendException e) {
            log.error("CONFIGURATION ERROR: pipeline for roomId={} selected unregistered backend '{}'",
                request.getRoomId(), e.getBackendId());
            fail(request, command, e);

        } catch (Exception e) {
            log.warn("Pipeline failed: roomId={}, command={}, error={}",
                request.getRoomId(), command, e.getMessage(), e);
            fail(request, command, e);

        } finally {
            metricsService.recordPipelineRun(command.metricName(),
                Duration.ofMillis(System.currentTimeMillis() - start), success);
        }
    }

    // ===== Branches =====

    private void handleInventory(PipelineRequest request) {
        String body = classifier.stripTrigger(request.getContent(), AgentCommand.INVENTORY);
        String reply = ingestionHandler.ingest(request.getUserId(), body);
        roomMessageService.postAgentMessage(request.getRoomId(), reply);
    }

    private void handleAnalysis(PipelineRequest request) {
        String backend = modelPreferenceService.resolveBackend(request.getUserId());
        InventorySnapshot snapshot = inventoryService.snapshot(request.getUserId());
        if (snapshot.isEmpty()) {
            roomMessageService.postAgentMessage(request.getRoomId(), EMPTY_INVENTORY_REPLY);
            return;
        }

        List<CatalogCandidate> candidates = retrievalAdapter.findRelatedToAll(snapshot.lowStockNames());
        String raw = generationService.generate(prompts.analysis(snapshot, candidates), backend);
        InventoryAnalysis analysis = decoder.decodeAnalysis(extractor.extract(raw), snapshot);

        emit(request, backend, analysis);
        roomMessageService.postAgentMessage(request.getRoomId(), ANALYSIS_READY);
    }

    private void handleMenu(PipelineRequest request) {
        String backend = modelPreferenceService.resolveBackend(request.getUserId());
        InventorySnapshot snapshot = inventoryService.snapshot(request.getUserId());
        if (snapshot.isEmpty()) {
            roomMessageService.postAgentMessage(request.getRoomId(), EMPTY_INVENTORY_REPLY);
            return;
        }

        List<CatalogCandidate> candidates = retrievalAdapter.findRelatedToAll(snapshot.allNames());
        String raw = generationService.generate(prompts.menu(snapshot, candidates), backend);
        MenuSuggestion menu = decoder.decodeMenu(extractor.extract(raw), raw);

        emit(request, backend, menu);
        roomMessageService.postAgentMessage(request.getRoomId(), MENU_READY);
    }

    private void handleRestock(PipelineRequest request) {
        String backend = modelPreferenceService.resolveBackend(request.getUserId());
        InventorySnapshot snapshot = inventoryService.snapshot(request.getUserId());
        if (snapshot.isEmpty()) {
            roomMessageService.postAgentMessage(request.getRoomId(), EMPTY_INVENTORY_REPLY);
            return;
        }
        if (snapshot.getLowStock().isEmpty()) {
            roomMessageService.postAgentMessage(request.getRoomId(), NOTHING_TO_RESTOCK_REPLY);
            return;
        }

        List<CatalogCandidate> candidates = retrievalAdapter.findRelatedToAll(snapshot.lowStockNames());
        String raw = generationService.generate(prompts.restock(snapshot, candidates), backend);
        RestockPlan plan = decoder.decodeRestock(extractor.extract(raw), raw);

        emit(request, backend, plan);
        roomMessageService.postAgentMessage(request.getRoomId(), RESTOCK_READY);
    }

    private void handlePlan(PipelineRequest request) {
        String backend = modelPreferenceService.resolveBackend(request.getUserId());
        String history = formatHistory(request.getRoomId());

        String goalRaw = generationService.generate(prompts.goal(history), backend);
        String goal = decoder.decodeGoal(extractor.extract(goalRaw));

        String raw = generationService.generate(prompts.procurementPlan(history, goal), backend);
        ProcurementPlan plan = decoder.decodePlan(extractor.extract(raw), goal);

        emit(request, backend, plan);
    }

    private void handleMention(PipelineRequest request) {
        String question = classifier.stripTrigger(request.getContent(), AgentCommand.MENTION);
        if (question.isEmpty()) {
            roomMessageService.postAgentMessage(request.getRoomId(), EMPTY_MENTION_REPLY);
            return;
        }
        String backend = modelPreferenceService.resolveBackend(request.getUserId());
        String reply = generationService.generate(prompts.mention(question), backend);
        roomMessageService.postAgentMessage(request.getRoomId(), reply);
    }

    // ===== Helpers =====

    private void emit(PipelineRequest request, String backend, AgentResult result) {
        int delivered = roomMessageService.broadcastEvent(request.getRoomId(), result);
        log.info("Agent event emitted: roomId={}, kind={}, backend={}, delivered={}",
            request.getRoomId(), result.kind().getWireName(), backend, delivered);
        if (eventPublisher != null) {
            eventPublisher.publishAgentEvent(request.getRoomId(), request.getUserId(), backend, result);
        }
    }

    /**
     * Chronological {@code - name: content} lines of the room's recent messages
     */
    private String formatHistory(Long roomId) {
        List<ChatMessage> messages = new ArrayList<>(roomMessageService.recent(roomId, historyLimit));
        Collections.reverse(messages);

        Map<Long, String> names = new HashMap<>();
        StringBuilder text = new StringBuilder();
        for (ChatMessage message : messages) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append("- ")
                .append(roomMessageService.displayName(message, names))
                .append(": ")
                .append(message.getContent());
        }
        return text.toString();
    }

    private void fail(PipelineRequest request, AgentCommand command, Exception e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        metricsService.recordError(e.getClass().getSimpleName(), "AgentPipeline");
        String prefix = e instanceof GenerationException ? ERROR_PREFIX : AGENT_ERROR_PREFIX;
        postSafely(request.getRoomId(), prefix + detail);
        if (eventPublisher != null) {
            eventPublisher.publishAgentFailure(request.getRoomId(), command.metricName(), detail);
        }
    }

    private void postSafely(Long roomId, String content) {
        try {
            roomMessageService.postAgentMessage(roomId, content);
        } catch (RuntimeException e) {
            log.error("Could not post agent reply: roomId={}", roomId, e);
        }
    }
}

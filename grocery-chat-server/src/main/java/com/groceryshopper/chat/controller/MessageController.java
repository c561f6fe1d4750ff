package com.groceryshopper.chat.controller;

import com.groceryshopper.chat.domain.ChatMessage;
import com.groceryshopper.chat.domain.MessageView;
import com.groceryshopper.chat.domain.PipelineRequest;
import com.groceryshopper.chat.service.ChatAccessException;
import com.groceryshopper.chat.service.RoomMessageService;
import com.groceryshopper.chat.service.SecurityValidator;
import com.groceryshopper.chat.service.agent.AgentPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Room message endpoints. Posting stores the message, fans it out, then hands it to the agent.
 */
@Slf4j
@RestController
@RequestMapping("/api/rooms")
@CrossOrigin(origins = "*")
public class MessageController {

    private final RoomMessageService roomMessageService;
    private final AgentPipeline agentPipeline;
    private final SecurityValidator securityValidator;

    public MessageController(RoomMessageService roomMessageService,
                             AgentPipeline agentPipeline,
                             SecurityValidator securityValidator) {
        this.roomMessageService = roomMessageService;
        this.agentPipeline = agentPipeline;
        this.securityValidator = securityValidator;
    }

    /**
     * Post a message
     * POST /api/rooms/{roomId}/messages
     */
    @PostMapping("/{roomId}/messages")
    public ResponseEntity<?> postMessage(@PathVariable Long roomId,
                                         @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @RequestBody Map<String, Object> request) {
        try {
            String username = securityValidator.authenticate(authorization);
            Object content = request.get("content");
            if (!(content instanceof String) || ((String) content).isBlank()) {
                return ResponseEntity.badRequest().body(Map.of(
                        "error", "Bad request",
                        "detail", "content is required"));
            }

            ChatMessage saved = roomMessageService.postUserMessage(roomId, username, (String) content);
            agentPipeline.dispatch(PipelineRequest.builder()
                    .roomId(roomId)
                    .userId(saved.getUserId())
                    .content(saved.getContent())
                    .build());

            return ResponseEntity.ok(Map.of("ok", true, "id", saved.getId()));

        } catch (ChatAccessException e) {
            log.warn("Message rejected: roomId={}, status={}, reason={}", roomId, e.getStatus(), e.getMessage());
            return ResponseEntity.status(e.getStatus()).body(Map.of(
                    "error", e.getStatus().getReasonPhrase(),
                    "detail", e.getMessage()));

        } catch (Exception e) {
            log.error("Error posting message: roomId={}", roomId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Internal server error",
                    "detail", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Recent messages in chronological order
     * GET /api/rooms/{roomId}/messages?limit=50
     */
    @GetMapping("/{roomId}/messages")
    public ResponseEntity<?> getMessages(@PathVariable Long roomId,
                                         @RequestParam(defaultValue = "50") int limit) {
        try {
            List<MessageView> messages = roomMessageService.history(roomId, limit);
            return ResponseEntity.ok(Map.of("messages", messages));

        } catch (ChatAccessException e) {
            return ResponseEntity.status(e.getStatus()).body(Map.of(
                    "error", e.getStatus().getReasonPhrase(),
                    "detail", e.getMessage()));

        } catch (Exception e) {
            log.error("Error loading messages: roomId={}", roomId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                    "error", "Internal server error",
                    "detail", String.valueOf(e.getMessage())));
        }
    }
}

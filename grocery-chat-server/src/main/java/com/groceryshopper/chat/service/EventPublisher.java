package com.groceryshopper.chat.service;

import com.groceryshopper.chat.domain.AgentResult;
import com.groceryshopper.chat.domain.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Audit events for Kafka (optional)
 *
 * Publishes chat messages and agent outcomes for:
 * - Audit trail
 * - Analytics
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-events:chat-events}")
    private String chatEventsTopic;

    @Value("${kafka.topics.agent-events:agent-events}")
    private String agentEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    /**
     * Publish a stored chat message, human or agent
     */
    public void publishChatMessage(ChatMessage message) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "CHAT_MESSAGE");
        event.put("timestamp", Instant.now().toString());
        event.put("messageId", message.getId());
        event.put("roomId", message.getRoomId());
        event.put("userId", message.getUserId());
        event.put("isBot", message.isBot());
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);

        publishEvent(chatEventsTopic, String.valueOf(message.getRoomId()), event, "CHAT_MESSAGE");
    }

    /**
     * Publish a completed agent command with its typed result
     */
    public void publishAgentEvent(Long roomId, Long userId, String backend, AgentResult result) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "AGENT_EVENT");
        event.put("timestamp", Instant.now().toString());
        event.put("roomId", roomId);
        event.put("userId", userId);
        event.put("backend", backend);
        event.put("kind", result.kind().getWireName());
        event.put("result", result);

        publishEvent(agentEventsTopic, String.valueOf(roomId), event, "AGENT_EVENT");
    }

    /**
     * Publish a pipeline failure that was turned into an agent error message
     */
    public void publishAgentFailure(Long roomId, String command, String error) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "AGENT_FAILURE");
        event.put("timestamp", Instant.now().toString());
        event.put("roomId", roomId);
        event.put("command", command);
        event.put("error", error);

        publishEvent(agentEventsTopic, String.valueOf(roomId), event, "AGENT_FAILURE");
    }

    private void publishEvent(String topic, String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(topic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, topic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}

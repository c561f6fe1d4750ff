package com.groceryshopper.chat.handler;

import com.groceryshopper.chat.infrastructure.InvalidRoomException;
import com.groceryshopper.chat.infrastructure.RoomConnectionRegistry;
import com.groceryshopper.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;

/**
 * Room WebSocket endpoint: {@code /ws?room_id=<id>}.
 * <p>
 * Clients mostly listen. The room id is validated here, before the registry sees the
 * connection, and every connection is registered through a send decorator so that one slow
 * client cannot hold up delivery to the rest of the room.
 */
@Slf4j
@Component
public class RoomWebSocketHandler extends TextWebSocketHandler {

    static final String ROOM_ID_ATTRIBUTE = "roomId";
    static final String CONNECTION_ATTRIBUTE = "decoratedConnection";

    private final RoomConnectionRegistry registry;
    private final MetricsService metricsService;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public RoomWebSocketHandler(RoomConnectionRegistry registry,
                                MetricsService metricsService,
                                @Value("${websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                @Value("${websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.registry = registry;
        this.metricsService = metricsService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String roomIdParam = extractRoomId(wsSession);
        if (roomIdParam == null || roomIdParam.isBlank()) {
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("room_id required"));
            return;
        }

        long roomId;
        try {
            roomId = Long.parseLong(roomIdParam.trim());
        } catch (NumberFormatException e) {
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("room_id must be integer"));
            return;
        }

        WebSocketSession connection = new ConcurrentWebSocketSessionDecorator(
                wsSession, sendTimeLimitMs, bufferSizeLimit);
        try {
            registry.subscribe(connection, roomId);
        } catch (InvalidRoomException e) {
            log.warn("Rejected connection: wsId={}, roomId={}", wsSession.getId(), roomId);
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("room_id must be positive"));
            return;
        }

        wsSession.getAttributes().put(ROOM_ID_ATTRIBUTE, roomId);
        wsSession.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        log.info("WebSocket connected: wsId={}, roomId={}", wsSession.getId(), roomId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        String payload = message.getPayload().trim();
        log.debug("Received frame from {}: {}", wsSession.getId(), payload);

        // Chat traffic goes through the REST endpoint; only keep-alives arrive here
        String reply = switch (payload) {
            case "ping" -> "pong";
            case "{\"type\":\"ping\"}" -> "{\"type\":\"pong\"}";
            default -> null;
        };
        if (reply == null) {
            return;
        }

        try {
            connectionOf(wsSession).sendMessage(new TextMessage(reply));
        } catch (IOException e) {
            log.warn("Failed to answer ping: wsId={}, error={}", wsSession.getId(), e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        Long roomId = (Long) wsSession.getAttributes().get(ROOM_ID_ATTRIBUTE);
        log.info("WebSocket closed: wsId={}, roomId={}, status={}", wsSession.getId(), roomId, status);
        if (roomId != null) {
            registry.unsubscribe(connectionOf(wsSession), roomId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        Long roomId = (Long) wsSession.getAttributes().get(ROOM_ID_ATTRIBUTE);
        log.warn("WebSocket transport error: wsId={}, roomId={}, error={}",
                wsSession.getId(), roomId, exception.getMessage());
        metricsService.recordError("TRANSPORT_ERROR", "RoomWebSocketHandler");
        if (roomId != null) {
            registry.unsubscribe(connectionOf(wsSession), roomId);
        }
    }

    private WebSocketSession connectionOf(WebSocketSession wsSession) {
        Object decorated = wsSession.getAttributes().get(CONNECTION_ATTRIBUTE);
        return decorated instanceof WebSocketSession connection ? connection : wsSession;
    }

    private String extractRoomId(WebSocketSession wsSession) {
        if (wsSession.getUri() == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(wsSession.getUri())
                .build()
                .getQueryParams()
                .getFirst("room_id");
    }
}

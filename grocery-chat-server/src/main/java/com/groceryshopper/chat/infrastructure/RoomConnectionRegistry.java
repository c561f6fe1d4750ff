package com.groceryshopper.chat.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory registry of live WebSocket connections grouped by room.
 * <p>
 * Membership changes take the write lock; a broadcast copies the room's members under the
 * read lock and sends outside of it, so a broadcast always works on the membership as it was
 * when the broadcast started. A connection belongs to at most one room. Connections that fail
 * a send are dropped by the broadcast that saw the failure.
 * <p>
 * Nothing here is persisted: after a restart clients must subscribe again.
 */
@Component
@Slf4j
public class RoomConnectionRegistry {

    private final Map<Long, Map<String, WebSocketSession>> rooms = new HashMap<>();
    private final Map<String, Long> roomByConnectionId = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    public RoomConnectionRegistry(ObjectMapper objectMapper, MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    /**
     * Register a connection under a room. A connection already registered under another
     * room is moved.
     *
     * @throws InvalidRoomException if {@code roomId} is not a positive integer
     */
    public void subscribe(WebSocketSession connection, Long roomId) {
        if (roomId == null || roomId <= 0) {
            throw new InvalidRoomException(roomId);
        }

        String connectionId = connection.getId();
        lock.writeLock().lock();
        try {
            Long previousRoom = roomByConnectionId.put(connectionId, roomId);
            if (previousRoom != null && !previousRoom.equals(roomId)) {
                removeFromRoom(previousRoom, connectionId);
                log.warn("Connection moved between rooms: connectionId={}, from={}, to={}",
                        connectionId, previousRoom, roomId);
            }
            rooms.computeIfAbsent(roomId, k -> new LinkedHashMap<>()).put(connectionId, connection);
        } finally {
            lock.writeLock().unlock();
        }

        metricsService.recordConnectionOpened(roomId);
        log.info("Connection subscribed: connectionId={}, roomId={}", connectionId, roomId);
    }

    /**
     * Remove a connection from a room. Removing an absent connection is a no-op.
     *
     * @return true if the connection was registered under the room
     */
    public boolean unsubscribe(WebSocketSession connection, Long roomId) {
        String connectionId = connection.getId();
        boolean removed;

        lock.writeLock().lock();
        try {
            removed = roomId != null
                    && roomId.equals(roomByConnectionId.get(connectionId))
                    && removeFromRoom(roomId, connectionId);
            if (removed) {
                roomByConnectionId.remove(connectionId);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed) {
            metricsService.recordConnectionClosed(roomId);
            log.info("Connection unsubscribed: connectionId={}, roomId={}", connectionId, roomId);
        }
        return removed;
    }

    /**
     * Serialize {@code payload} once and send it to every connection currently in the room.
     * Connections that are closed or whose send throws are removed from the registry.
     *
     * @return number of connections the payload was written to
     */
    public int broadcast(Long roomId, Object payload) {
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize broadcast payload: roomId={}", roomId, e);
            metricsService.recordError("SERIALIZATION_ERROR", "RoomConnectionRegistry");
            return 0;
        }

        List<WebSocketSession> members = snapshot(roomId);
        if (members.isEmpty()) {
            log.debug("No connections for room: roomId={}", roomId);
            return 0;
        }

        int delivered = 0;
        List<WebSocketSession> dead = new ArrayList<>();
        for (WebSocketSession connection : members) {
            if (!connection.isOpen()) {
                dead.add(connection);
                continue;
            }
            try {
                connection.sendMessage(frame);
                delivered++;
            } catch (Exception e) {
                log.warn("Send failed, dropping connection: connectionId={}, roomId={}, error={}",
                        connection.getId(), roomId, e.getMessage());
                dead.add(connection);
            }
        }

        if (!dead.isEmpty()) {
            evict(roomId, dead);
        }

        metricsService.recordBroadcast(roomId, delivered, dead.size());
        log.debug("Broadcast to room: roomId={}, delivered={}, dropped={}", roomId, delivered, dead.size());
        return delivered;
    }

    /**
     * Connection ids currently registered under the room
     */
    public Set<String> getConnectionIds(Long roomId) {
        lock.readLock().lock();
        try {
            Map<String, WebSocketSession> members = rooms.get(roomId);
            return members == null
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(new LinkedHashSet<>(members.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getConnectionCount() {
        lock.readLock().lock();
        try {
            return roomByConnectionId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<WebSocketSession> snapshot(Long roomId) {
        lock.readLock().lock();
        try {
            Map<String, WebSocketSession> members = rooms.get(roomId);
            return members == null ? List.of() : new ArrayList<>(members.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void evict(Long roomId, List<WebSocketSession> dead) {
        List<WebSocketSession> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (WebSocketSession connection : dead) {
                String connectionId = connection.getId();
                Map<String, WebSocketSession> members = rooms.get(roomId);
                // Skip if the id was re-registered with a new session meanwhile
                if (members != null && members.get(connectionId) == connection) {
                    removeFromRoom(roomId, connectionId);
                    roomByConnectionId.remove(connectionId);
                    removed.add(connection);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        // Connections already unsubscribed elsewhere were counted there
        for (WebSocketSession connection : removed) {
            metricsService.recordConnectionClosed(roomId);
        }
        dead.forEach(this::closeQuietly);
    }

    // Caller holds the write lock
    private boolean removeFromRoom(Long roomId, String connectionId) {
        Map<String, WebSocketSession> members = rooms.get(roomId);
        if (members == null) {
            return false;
        }
        boolean removed = members.remove(connectionId) != null;
        if (members.isEmpty()) {
            rooms.remove(roomId);
        }
        return removed;
    }

    private void closeQuietly(WebSocketSession connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close after failed send also failed: connectionId={}, error={}",
                    connection.getId(), e.getMessage());
        }
    }
}

package com.groceryshopper.chat.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryshopper.chat.service.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomConnectionRegistryTest {

    @Mock
    private MetricsService metricsService;

    private RoomConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomConnectionRegistry(new ObjectMapper(), metricsService);
    }

    private WebSocketSession connection(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        lenient().when(session.getId()).thenReturn(id);
        lenient().when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Nested
    @DisplayName("Subscription")
    class SubscriptionTests {

        @Test
        @DisplayName("Should reject non-positive room ids")
        void shouldRejectNonPositiveRoomIds() {
            WebSocketSession a = connection("a");

            assertThatThrownBy(() -> registry.subscribe(a, 0L))
                    .isInstanceOf(InvalidRoomException.class);
            assertThatThrownBy(() -> registry.subscribe(a, -3L))
                    .isInstanceOf(InvalidRoomException.class);
            assertThatThrownBy(() -> registry.subscribe(a, null))
                    .isInstanceOf(InvalidRoomException.class);
            assertThat(registry.getConnectionCount()).isZero();
        }

        @Test
        @DisplayName("Should keep a connection in at most one room")
        void shouldMoveConnectionBetweenRooms() {
            // Given
            WebSocketSession a = connection("a");
            registry.subscribe(a, 1L);

            // When
            registry.subscribe(a, 2L);

            // Then
            assertThat(registry.getConnectionIds(1L)).isEmpty();
            assertThat(registry.getConnectionIds(2L)).containsExactly("a");
            assertThat(registry.getConnectionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Double unsubscribe should be a no-op")
        void doubleUnsubscribeIsNoOp() {
            // Given
            WebSocketSession a = connection("a");
            registry.subscribe(a, 1L);

            // When
            boolean first = registry.unsubscribe(a, 1L);
            boolean second = registry.unsubscribe(a, 1L);

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(registry.getConnectionIds(1L)).isEmpty();
            verify(metricsService, times(1)).recordConnectionClosed(1L);
        }

        @Test
        @DisplayName("Unsubscribe with the wrong room should leave membership alone")
        void unsubscribeFromOtherRoomDoesNothing() {
            WebSocketSession a = connection("a");
            registry.subscribe(a, 1L);

            assertThat(registry.unsubscribe(a, 2L)).isFalse();
            assertThat(registry.getConnectionIds(1L)).containsExactly("a");
        }
    }

    @Nested
    @DisplayName("Broadcast")
    class BroadcastTests {

        @Test
        @DisplayName("Should reach exactly the connections of the target room")
        void shouldReachOnlyTargetRoom() throws IOException {
            // Given
            WebSocketSession a = connection("a");
            WebSocketSession b = connection("b");
            WebSocketSession c = connection("c");
            registry.subscribe(a, 1L);
            registry.subscribe(b, 1L);
            registry.subscribe(c, 2L);

            // When
            int delivered = registry.broadcast(1L, Map.of("type", "message"));

            // Then
            assertThat(delivered).isEqualTo(2);
            verify(a).sendMessage(any(TextMessage.class));
            verify(b).sendMessage(any(TextMessage.class));
            verify(c, never()).sendMessage(any());
        }

        @Test
        @DisplayName("Should serialize the payload as JSON once for all receivers")
        void shouldSendSerializedPayload() throws IOException {
            // Given
            WebSocketSession a = connection("a");
            registry.subscribe(a, 5L);

            // When
            registry.broadcast(5L, Map.of("room_id", 5));

            // Then
            ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
            verify(a).sendMessage(frame.capture());
            assertThat(frame.getValue().getPayload()).isEqualTo("{\"room_id\":5}");
        }

        @Test
        @DisplayName("Should drop a connection whose send fails and keep delivering to the rest")
        void shouldEvictFailedConnection() throws IOException {
            // Given
            WebSocketSession healthy = connection("ok");
            WebSocketSession broken = connection("broken");
            doThrow(new IOException("pipe closed")).when(broken).sendMessage(any());
            registry.subscribe(broken, 1L);
            registry.subscribe(healthy, 1L);

            // When
            int delivered = registry.broadcast(1L, Map.of("k", "v"));

            // Then
            assertThat(delivered).isEqualTo(1);
            assertThat(registry.getConnectionIds(1L)).containsExactly("ok");
            verify(broken).close(CloseStatus.SESSION_NOT_RELIABLE);
            verify(metricsService).recordBroadcast(1L, 1, 1);
        }

        @Test
        @DisplayName("Should drop connections that are no longer open without sending")
        void shouldEvictClosedConnection() throws IOException {
            // Given
            WebSocketSession closed = connection("closed");
            when(closed.isOpen()).thenReturn(false);
            registry.subscribe(closed, 3L);

            // When
            int delivered = registry.broadcast(3L, Map.of("k", "v"));

            // Then
            assertThat(delivered).isZero();
            assertThat(registry.getConnectionIds(3L)).isEmpty();
            verify(closed, never()).sendMessage(any());
        }

        @Test
        @DisplayName("Should count a close once when the connection unsubscribes while its send fails")
        void shouldNotDoubleCountConcurrentClose() throws IOException {
            // Given
            WebSocketSession broken = connection("broken");
            registry.subscribe(broken, 1L);
            doAnswer(invocation -> {
                registry.unsubscribe(broken, 1L);
                throw new IOException("connection reset");
            }).when(broken).sendMessage(any());

            // When
            int delivered = registry.broadcast(1L, Map.of("k", "v"));

            // Then
            assertThat(delivered).isZero();
            assertThat(registry.getConnectionCount()).isZero();
            verify(metricsService, times(1)).recordConnectionClosed(1L);
        }

        @Test
        @DisplayName("Should return zero for a room without connections")
        void shouldHandleEmptyRoom() {
            assertThat(registry.broadcast(99L, Map.of("k", "v"))).isZero();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should keep membership and gauge consistent under concurrent subscribe, broadcast and unsubscribe")
        void shouldStayConsistentUnderConcurrentUse() throws Exception {
            // Given
            MetricsService metrics = new MetricsService();
            RoomConnectionRegistry shared = new RoomConnectionRegistry(new ObjectMapper(), metrics);
            List<WebSocketSession> connections = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                connections.add(connection("c" + i));
            }

            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < connections.size(); i++) {
                WebSocketSession session = connections.get(i);
                long roomId = 1 + (i % 4);
                boolean leave = i % 2 == 0;
                tasks.add(() -> {
                    shared.subscribe(session, roomId);
                    shared.broadcast(roomId, Map.of("type", "message"));
                    return !leave || shared.unsubscribe(session, roomId);
                });
            }

            // When
            ExecutorService pool = Executors.newFixedThreadPool(8);
            List<Future<Boolean>> results;
            try {
                results = pool.invokeAll(tasks);
            } finally {
                pool.shutdown();
            }
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            // Then
            for (Future<Boolean> result : results) {
                assertThat(result.get()).isTrue();
            }
            assertThat(shared.getConnectionCount()).isEqualTo(200);
            int perRoom = 0;
            for (long roomId = 1; roomId <= 4; roomId++) {
                perRoom += shared.getConnectionIds(roomId).size();
            }
            assertThat(perRoom).isEqualTo(200);
            assertThat(metrics.getGaugeValue("active_connections")).isEqualTo(200);
        }
    }
}

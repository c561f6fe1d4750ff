package com.groceryshopper.chat.service;

import com.groceryshopper.chat.domain.AgentResult;
import com.groceryshopper.chat.domain.ChatMessage;
import com.groceryshopper.chat.domain.MessageView;
import com.groceryshopper.chat.domain.RoomBroadcast;
import com.groceryshopper.chat.domain.UserAccount;
import com.groceryshopper.chat.infrastructure.RoomConnectionRegistry;
import com.groceryshopper.chat.repository.ChatMessageRepository;
import com.groceryshopper.chat.repository.RoomMemberRepository;
import com.groceryshopper.chat.repository.RoomRepository;
import com.groceryshopper.chat.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores room messages and fans them out to the room's live connections.
 * Both human posts and agent replies go through here, so every stored message is broadcast once.
 */
@Service
@Slf4j
public class RoomMessageService {

    private final ChatMessageRepository chatMessageRepository;
    private final RoomRepository roomRepository;
    private final RoomMemberRepository roomMemberRepository;
    private final UserAccountRepository userAccountRepository;
    private final RoomConnectionRegistry connectionRegistry;

    // Optional: Kafka audit publisher (null if Kafka is disabled)
    private final EventPublisher eventPublisher;

    private final String agentName;

    public RoomMessageService(ChatMessageRepository chatMessageRepository,
                              RoomRepository roomRepository,
                              RoomMemberRepository roomMemberRepository,
                              UserAccountRepository userAccountRepository,
                              RoomConnectionRegistry connectionRegistry,
                              @Value("${agent.name:LLM Bot}") String agentName,
                              @Autowired(required = false) EventPublisher eventPublisher) {
        this.chatMessageRepository = chatMessageRepository;
        this.roomRepository = roomRepository;
        this.roomMemberRepository = roomMemberRepository;
        this.userAccountRepository = userAccountRepository;
        this.connectionRegistry = connectionRegistry;
        this.eventPublisher = eventPublisher;
        this.agentName = agentName;
    }

    /**
     * Check room, user and membership, then store and broadcast the message.
     *
     * @throws ChatAccessException 404 unknown room, 401 unknown user, 403 not a member
     */
    public ChatMessage postUserMessage(Long roomId, String username, String content) {
        UserAccount user = requireMember(roomId, username);

        ChatMessage saved = chatMessageRepository.save(ChatMessage.builder()
            .roomId(roomId)
            .userId(user.getId())
            .content(content)
            .bot(false)
            .build());

        log.info("Message stored: roomId={}, userId={}, messageId={}", roomId, user.getId(), saved.getId());
        fanOut(saved, user.getUsername());
        return saved;
    }

    public ChatMessage postAgentMessage(Long roomId, String content) {
        ChatMessage saved = chatMessageRepository.save(ChatMessage.builder()
            .roomId(roomId)
            .userId(null)
            .content(content)
            .bot(true)
            .build());

        log.debug("Agent message stored: roomId={}, messageId={}", roomId, saved.getId());
        fanOut(saved, agentName);
        return saved;
    }

    public int broadcastEvent(Long roomId, AgentResult result) {
        return connectionRegistry.broadcast(roomId, RoomBroadcast.aiEvent(roomId, result));
    }

    /**
     * Most recent messages of a room in chronological order
     *
     * @throws ChatAccessException 404 when the room does not exist
     */
    public List<MessageView> history(Long roomId, int limit) {
        if (!roomRepository.existsById(roomId)) {
            throw new ChatAccessException(HttpStatus.NOT_FOUND, "Room not found");
        }
        List<ChatMessage> newestFirst = recent(roomId, limit);
        List<ChatMessage> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);

        Map<Long, String> usernames = new HashMap<>();
        List<MessageView> views = new ArrayList<>(chronological.size());
        for (ChatMessage message : chronological) {
            views.add(MessageView.of(message, displayName(message, usernames)));
        }
        return views;
    }

    /**
     * Newest-first messages, used by the procurement planner as chat history
     */
    public List<ChatMessage> recent(Long roomId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return chatMessageRepository.findRecentByRoomId(roomId, PageRequest.of(0, limit));
    }

    /**
     * Display name of a message author; {@code cache} avoids repeated user lookups
     */
    public String displayName(ChatMessage message, Map<Long, String> cache) {
        if (message.isBot() || message.getUserId() == null) {
            return agentName;
        }
        return cache.computeIfAbsent(message.getUserId(), id -> userAccountRepository.findById(id)
            .map(UserAccount::getUsername)
            .orElse("unknown"));
    }

    public String getAgentName() {
        return agentName;
    }

    private UserAccount requireMember(Long roomId, String username) {
        if (!roomRepository.existsById(roomId)) {
            throw new ChatAccessException(HttpStatus.NOT_FOUND, "Room not found");
        }
        UserAccount user = userAccountRepository.findByUsername(username)
            .orElseThrow(() -> new ChatAccessException(HttpStatus.UNAUTHORIZED, "Invalid user"));
        if (!roomMemberRepository.isActiveMember(roomId, user.getId())) {
            throw new ChatAccessException(HttpStatus.FORBIDDEN, "Not a member of this room");
        }
        return user;
    }

    private void fanOut(ChatMessage message, String username) {
        connectionRegistry.broadcast(message.getRoomId(),
            RoomBroadcast.message(message.getRoomId(), MessageView.of(message, username)));
        if (eventPublisher != null) {
            eventPublisher.publishChatMessage(message);
        }
    }
}

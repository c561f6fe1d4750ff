package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frame pushed to every connection of a room.
 * Either a chat {@code message} or an {@code ai_event} carrying a typed agent result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomBroadcast {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_AI_EVENT = "ai_event";

    private String type;

    @JsonProperty("room_id")
    private Long roomId;

    private MessageView message;

    private AgentEventKind event;

    private String narrative;

    private Object payload;

    public static RoomBroadcast message(Long roomId, MessageView message) {
        return RoomBroadcast.builder()
            .type(TYPE_MESSAGE)
            .roomId(roomId)
            .message(message)
            .build();
    }

    public static RoomBroadcast aiEvent(Long roomId, AgentResult result) {
        return RoomBroadcast.builder()
            .type(TYPE_AI_EVENT)
            .roomId(roomId)
            .event(result.kind())
            .narrative(result.getNarrative())
            .payload(result)
            .build();
    }
}

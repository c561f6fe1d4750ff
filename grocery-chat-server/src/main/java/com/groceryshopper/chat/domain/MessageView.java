package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-facing shape of a chat message, used by broadcasts and the history endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageView {

    private Long id;

    private String username;

    private String content;

    @JsonProperty("is_bot")
    private boolean bot;

    @JsonProperty("created_at")
    private String createdAt;

    public static MessageView of(ChatMessage message, String username) {
        return MessageView.builder()
            .id(message.getId())
            .username(username)
            .content(message.getContent())
            .bot(message.isBot())
            .createdAt(String.valueOf(message.getCreatedAt()))
            .build();
    }
}

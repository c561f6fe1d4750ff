package com.groceryshopper.chat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of structured agent results pushed as {@code ai_event} frames.
 */
public enum AgentEventKind {
    ANALYSIS("analysis"),
    MENU("menu"),
    RESTOCK("restock"),
    PROCUREMENT_PLAN("procurement-plan");

    private final String wireName;

    AgentEventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

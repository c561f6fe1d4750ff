package com.groceryshopper.chat.domain;

/**
 * Structured result of one agent command, decoded from backend output with defaults applied.
 * Implementations are serialized as the {@code payload} of an {@code ai_event} frame.
 */
public interface AgentResult {

    AgentEventKind kind();

    String getNarrative();
}

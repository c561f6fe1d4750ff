package com.groceryshopper.chat.service.agent;

/**
 * Commands recognized in chat text, in match priority order.
 */
public enum AgentCommand {

    INVENTORY("@inventory"),
    ANALYZE("@gro analyze"),
    MENU("@gro menu"),
    RESTOCK("@gro restock"),
    PLAN("@gro plan"),
    MENTION("@gro"),
    NONE(null);

    private final String trigger;

    AgentCommand(String trigger) {
        this.trigger = trigger;
    }

    public String getTrigger() {
        return trigger;
    }

    public boolean isTriggered() {
        return this != NONE;
    }

    public String metricName() {
        return name().toLowerCase();
    }
}

package com.groceryshopper.chat.service.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class CommandClassifierTest {

    private final CommandClassifier classifier = new CommandClassifier();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "@inventory Tomatoes, 5, 2        | INVENTORY",
            "@GRO Analyze please              | ANALYZE",
            "hey @gro menu for tonight?       | MENU",
            "@gro restock                     | RESTOCK",
            "@gro plan the party              | PLAN",
            "@gro what is in season?          | MENTION",
            "just chatting                    | NONE"
    })
    @DisplayName("Should classify by trigger")
    void classifiesByTrigger(String content, AgentCommand expected) {
        assertThat(classifier.classify(content)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Inventory trigger should win over an agent trigger in the same message")
    void inventoryWinsOverAgentTriggers() {
        assertThat(classifier.classify("@gro analyze and @inventory Milk, 1, 2"))
                .isEqualTo(AgentCommand.INVENTORY);
    }

    @Test
    @DisplayName("Analysis should win over menu when both appear")
    void priorityOrderIsRespected() {
        assertThat(classifier.classify("@gro menu or @gro analyze")).isEqualTo(AgentCommand.ANALYZE);
    }

    @Test
    @DisplayName("Should strip the trigger regardless of case")
    void stripsTrigger() {
        assertThat(classifier.stripTrigger("@Gro  what is a shallot?", AgentCommand.MENTION))
                .isEqualTo("what is a shallot?");
        assertThat(classifier.stripTrigger("@inventory\nTomatoes, 50, 20", AgentCommand.INVENTORY))
                .isEqualTo("Tomatoes, 50, 20");
    }

    @Test
    @DisplayName("Empty and null content should not trigger anything")
    void emptyContentIsNone() {
        assertThat(classifier.classify("")).isEqualTo(AgentCommand.NONE);
        assertThat(classifier.classify(null)).isEqualTo(AgentCommand.NONE);
    }
}

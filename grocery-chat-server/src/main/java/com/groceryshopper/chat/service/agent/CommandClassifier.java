package com.groceryshopper.chat.service.agent;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive trigger matching. First match in {@link AgentCommand} order wins.
 */
@Component
public class CommandClassifier {

    public AgentCommand classify(String content) {
        if (content == null || content.isEmpty()) {
            return AgentCommand.NONE;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (AgentCommand command : AgentCommand.values()) {
            if (command.getTrigger() != null && lower.contains(command.getTrigger())) {
                return command;
            }
        }
        return AgentCommand.NONE;
    }

    /**
     * Remove every occurrence of the command's trigger, ignoring case, and trim the rest
     */
    public String stripTrigger(String content, AgentCommand command) {
        if (content == null) {
            return "";
        }
        if (command.getTrigger() == null) {
            return content.trim();
        }
        Pattern pattern = Pattern.compile(Pattern.quote(command.getTrigger()), Pattern.CASE_INSENSITIVE);
        return pattern.matcher(content).replaceAll("").trim();
    }
}

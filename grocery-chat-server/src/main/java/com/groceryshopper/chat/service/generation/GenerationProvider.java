package com.groceryshopper.chat.service.generation;

import com.groceryshopper.chat.domain.ChatTurn;
import com.groceryshopper.chat.domain.GenerationParams;

import java.util.List;

/**
 * Adapter for one text-generation backend. Each implementation owns the translation of
 * role-tagged turns into its wire format and of the reply back into plain text.
 */
public interface GenerationProvider {

    /**
     * Selector stored as a user's preference, e.g. {@code openai}
     */
    String backendId();

    /**
     * @throws BackendUnavailableException on network, auth, timeout or non-2xx failures
     * @throws BackendRejectedException    when the backend blocks the content
     */
    String generate(List<ChatTurn> turns, GenerationParams params);

    /**
     * Whether the backend is configured and reachable enough to be offered to users
     */
    boolean isAvailable();
}

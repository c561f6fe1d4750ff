package com.groceryshopper.chat.service.generation;

import java.util.Set;

/**
 * No adapter is registered under the requested backend id. This is a configuration error.
 */
public class UnknownBackendException extends GenerationException {

    public UnknownBackendException(String backendId, Set<String> registered) {
        super(backendId, "Unknown generation backend '" + backendId + "', registered: " + registered, null);
    }
}

package com.groceryshopper.chat.service.generation;

/**
 * Base type of generation failures. Carries the backend the call was routed to.
 */
public abstract class GenerationException extends RuntimeException {

    private final String backendId;

    protected GenerationException(String backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}

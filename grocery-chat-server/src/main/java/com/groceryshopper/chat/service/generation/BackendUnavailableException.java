package com.groceryshopper.chat.service.generation;

/**
 * Backend could not be reached or refused the credentials, or the call timed out.
 */
public class BackendUnavailableException extends GenerationException {

    public BackendUnavailableException(String backendId, String message) {
        super(backendId, message, null);
    }

    public BackendUnavailableException(String backendId, String message, Throwable cause) {
        super(backendId, message, cause);
    }
}

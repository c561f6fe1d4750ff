package com.groceryshopper.chat.service.generation;

/**
 * Backend answered but blocked the content (safety filter, policy).
 * Never leaves {@link GenerationService}; it is turned into a placeholder reply there.
 */
public class BackendRejectedException extends GenerationException {

    public BackendRejectedException(String backendId, String reason) {
        super(backendId, "Response blocked by " + backendId + ": " + reason, null);
    }
}

package com.groceryshopper.chat.service;

import org.springframework.http.HttpStatus;

/**
 * Request refused before any state change: unknown room, unknown user, or not a member.
 */
public class ChatAccessException extends RuntimeException {

    private final HttpStatus status;

    public ChatAccessException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

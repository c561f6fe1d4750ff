package com.groceryshopper.chat.service.generation;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps RestTemplate failures to {@link BackendUnavailableException}.
 */
final class ProviderErrors {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private ProviderErrors() {
    }

    static BackendUnavailableException unavailable(String backendId, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new BackendUnavailableException(backendId,
                    backendId + " unreachable or timed out: " + e.getMessage(), e);
        }
        if (e instanceof RestClientResponseException response) {
            String body = response.getResponseBodyAsString();
            if (body.length() > MAX_BODY_IN_MESSAGE) {
                body = body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
            }
            return new BackendUnavailableException(backendId,
                    backendId + " HTTP " + response.getStatusCode().value() + ": " + body, e);
        }
        return new BackendUnavailableException(backendId, backendId + " call failed: " + e.getMessage(), e);
    }
}

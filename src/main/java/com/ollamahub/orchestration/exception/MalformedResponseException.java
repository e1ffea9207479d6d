package com.ollamahub.orchestration.exception;

/**
 * Thrown by endpoint clients when a 2xx reply does not carry the expected payload.
 */
public class MalformedResponseException extends RuntimeException {

    public MalformedResponseException(String message) {
        super(message);
    }
}

package com.stellar.gateway.api;

/**
 * Thrown when the caller's input is incomplete or names an unresolvable asset.
 * Handler returns HTTP 400 with the exception message as {@code error}.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}

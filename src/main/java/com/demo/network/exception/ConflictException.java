package com.demo.network.exception;

/**
 * The requested change collides with the current state: closing an opportunity that is
 * already terminal, reviewing a candidate twice, inserting a duplicate edge.
 */
public class ConflictException extends NetworkException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

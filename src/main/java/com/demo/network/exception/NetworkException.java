package com.demo.network.exception;

/** Base type for failures the core reports to its caller. */
public abstract class NetworkException extends RuntimeException {

    protected NetworkException(String message) {
        super(message);
    }

    protected NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

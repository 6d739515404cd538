package com.demo.network.exception;

public class NotFoundException extends NetworkException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, String id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}

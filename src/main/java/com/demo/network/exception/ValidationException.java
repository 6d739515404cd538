package com.demo.network.exception;

/** Malformed input (out-of-range score, bad rating). Never persisted. */
public class ValidationException extends NetworkException {

    public ValidationException(String message) {
        super(message);
    }

    public static double requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be in [0,1] but was " + value);
        }
        return value;
    }

    public static double requirePercent(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new ValidationException(field + " must be in [0,100] but was " + value);
        }
        return value;
    }
}

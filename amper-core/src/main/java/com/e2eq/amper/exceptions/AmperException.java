package com.e2eq.amper.exceptions;

/**
 * Base of every failure reported by registration, attachment and policy composition.
 */
public class AmperException extends Exception {
    private static final long serialVersionUID = 1L;

    public AmperException(String message) {
        super(message);
    }

    public AmperException(String message, Throwable cause) {
        super(message, cause);
    }
}

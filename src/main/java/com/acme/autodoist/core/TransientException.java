package com.acme.autodoist.core;

/**
 * A failure expected to clear up when the sender redelivers.
 */
public class TransientException extends RuntimeException {
    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}

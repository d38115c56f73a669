package com.acme.autodoist.core;

public class TaskApiException extends TransientException {
    private final int status;

    public TaskApiException(String message, int status) {
        super(message);
        this.status = status;
    }

    public TaskApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatus() {
        return status;
    }
}

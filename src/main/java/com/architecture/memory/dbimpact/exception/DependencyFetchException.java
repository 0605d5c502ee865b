package com.architecture.memory.dbimpact.exception;

/**
 * Raised when dependency rows could not be loaded from the metadata repository in time.
 */
public class DependencyFetchException extends RuntimeException {

    private final boolean timedOut;

    public DependencyFetchException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}

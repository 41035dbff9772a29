package com.taskchat.storage;

/**
 * Unexpected persistence failure. Carries no user-facing detail; callers map it
 * to a generic error.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.cityexplorer.backend.domain.exception;

/**
 * An insert or delete could not be applied, either on a constraint violation or on a
 * connectivity failure.
 */
public class StoreWriteException extends CacheAsideException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

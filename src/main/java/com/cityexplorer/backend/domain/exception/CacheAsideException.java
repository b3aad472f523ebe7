package com.cityexplorer.backend.domain.exception;

/**
 * Base type of every failure a resolution can end with.
 */
public abstract class CacheAsideException extends RuntimeException {

    protected CacheAsideException(String message) {
        super(message);
    }

    protected CacheAsideException(String message, Throwable cause) {
        super(message, cause);
    }
}

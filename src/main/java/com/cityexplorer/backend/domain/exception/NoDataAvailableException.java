package com.cityexplorer.backend.domain.exception;

/**
 * The upstream provider answered, but had nothing for the key.
 * Callers should treat this as an empty result rather than a fault.
 */
public class NoDataAvailableException extends CacheAsideException {

    public NoDataAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

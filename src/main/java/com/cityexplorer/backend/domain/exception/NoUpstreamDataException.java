package com.cityexplorer.backend.domain.exception;

/**
 * Raised by a provider when its response holds an empty result set.
 */
public class NoUpstreamDataException extends RuntimeException {

    public NoUpstreamDataException(String provider) {
        super("No data returned by " + provider);
    }
}

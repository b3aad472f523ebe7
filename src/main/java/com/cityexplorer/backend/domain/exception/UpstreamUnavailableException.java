package com.cityexplorer.backend.domain.exception;

/**
 * The upstream fetch failed or timed out. Retrying is up to the caller.
 */
public class UpstreamUnavailableException extends CacheAsideException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

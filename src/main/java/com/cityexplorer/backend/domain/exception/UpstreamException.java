package com.cityexplorer.backend.domain.exception;

/**
 * Raised by a provider when the upstream call fails: non-2xx status, I/O error or unreadable body.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}

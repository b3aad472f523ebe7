package com.cityexplorer.backend.domain.exception;

public class StoreReadException extends CacheAsideException {

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

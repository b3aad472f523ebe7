package com.cityexplorer.backend.domain.exception;

/**
 * The requested resource type is not in the registry. Indicates misconfiguration, never retried.
 */
public class UnknownResourceException extends CacheAsideException {

    private final String resourceType;

    public UnknownResourceException(String resourceType) {
        super("Unknown resource type: " + resourceType);
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}

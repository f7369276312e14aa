package com.egg.exception;

/**
 * Exception thrown when a requested resource does not exist or is not owned by the caller.
 *
 * Ownership failures are reported as "not found" so that ids of other users'
 * resources are not disclosed.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found with RFC 7807 format.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    /**
     * @param resourceType human-readable type, e.g. "Event", "Todo"
     * @return a ResourceNotFoundException with message "{type} not found"
     */
    public static ResourceNotFoundException of(String resourceType) {
        return new ResourceNotFoundException(resourceType + " not found");
    }
}

package com.egg.exception;

/**
 * Exception thrown when a request conflicts with existing state,
 * e.g. registering a device that is linked to another user.
 *
 * GlobalExceptionHandler maps this to HTTP 409 Conflict with RFC 7807 format.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public static ConflictException deviceLinkedToAnotherUser() {
        return new ConflictException("Device is already linked to another user");
    }
}

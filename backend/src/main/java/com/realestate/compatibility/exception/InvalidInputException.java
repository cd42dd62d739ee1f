package com.realestate.compatibility.exception;

/**
 * Exception thrown when the parcel collection, the compatibility matrix or the run
 * parameters are structurally unusable. Raised before any geometric work starts.
 */
public class InvalidInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

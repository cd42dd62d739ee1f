package com.realestate.compatibility.exception;

/**
 * Exception thrown when the stored parcel layer cannot be read
 */
public class ParcelSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ParcelSourceException(String message) {
        super(message);
    }

    public ParcelSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

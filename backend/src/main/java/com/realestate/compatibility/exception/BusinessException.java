package com.realestate.compatibility.exception;

/**
 * Exception thrown for rule violations on auxiliary operations such as run log queries
 */
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}

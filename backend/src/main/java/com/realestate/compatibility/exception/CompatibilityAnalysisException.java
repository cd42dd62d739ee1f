package com.realestate.compatibility.exception;

/**
 * Exception thrown when a compatibility run fails after validation, e.g. on
 * geometry the topology engine cannot process
 */
public class CompatibilityAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CompatibilityAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.realestate.compatibility.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;


@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Structurally unusable parcels, matrix or parameters
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(
            InvalidInputException ex, WebRequest request) {

        log.warn("Rejected audit input: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Input", ex.getMessage(), request);
    }

    /**
     * Valid input the engine could not process, e.g. self-intersecting polygons
     */
    @ExceptionHandler(CompatibilityAnalysisException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisFailure(
            CompatibilityAnalysisException ex, WebRequest request) {

        log.error("Compatibility analysis failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Analysis Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(ParcelSourceException.class)
    public ResponseEntity<ErrorResponse> handleParcelSource(
            ParcelSourceException ex, WebRequest request) {

        log.error("Stored parcel layer unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Parcel Source Unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(
            DataAccessException ex, WebRequest request) {

        log.error("Database access error: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Database Error",
                "An error occurred while accessing the database. Please try again later.", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, WebRequest request) {

        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request",
                "Request body is not valid JSON for this endpoint. Check the parcel collection and matrix.", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex, WebRequest request) {

        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.putIfAbsent(error.getField(), error.getDefaultMessage())
        );
        log.warn("Rejected audit request fields: {}", errors.keySet());

        ErrorResponse errorDetails = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Validation Error",
                "Please correct the invalid input fields", request.getDescription(false));
        errorDetails.setFieldErrors(errors);
        return new ResponseEntity<>(errorDetails, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(
            BusinessException ex, WebRequest request) {

        return respond(HttpStatus.BAD_REQUEST, "Business Logic Error", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex, WebRequest request) {

        log.error("Unhandled exception occurred: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "System Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         WebRequest request) {
        return new ResponseEntity<>(ErrorResponse.of(status, error, message, request.getDescription(false)), status);
    }
}

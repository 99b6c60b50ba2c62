package com.williamcallahan.aivisibility.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with standardized error responses.
     *
     * @param e The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<ApiErrorResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation + ": " + e.getMessage(), e);
    }

    /**
     * Turns exceptions no controller handles itself into a 500 response.
     *
     * @param unexpected the unhandled exception
     * @return Internal server error response
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpectedException(RuntimeException unexpected) {
        log.error("Unhandled exception in {}", getClass().getSimpleName(), unexpected);
        return handleServiceException(unexpected, "process analysis request");
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    protected ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}

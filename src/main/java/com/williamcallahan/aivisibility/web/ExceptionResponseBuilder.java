package com.williamcallahan.aivisibility.web;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds an error response for a classified page analysis failure.
     *
     * @param status The HTTP status code
     * @param message The classified user message
     * @param errorType The failure classification
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiErrorResponse> buildAnalysisErrorResponse(
            HttpStatus status, String message, PageErrorType errorType) {
        String errorTypeValue = errorType == null ? null : errorType.toString();
        return ResponseEntity.status(status).body(new ApiErrorResponse("error", message, null, errorTypeValue));
    }

    /**
     * Describes an exception for diagnostics.
     *
     * @param exception exception to describe
     * @return class name and message, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        return exception.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}

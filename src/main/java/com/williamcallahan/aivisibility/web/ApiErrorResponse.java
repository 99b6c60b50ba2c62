package com.williamcallahan.aivisibility.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a standardized JSON error payload returned by API endpoints.
 *
 * @param status fixed status indicator ("error")
 * @param message user-facing error message
 * @param details optional diagnostic details suitable for clients
 * @param errorType page failure classification when the error comes from an analysis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details, String errorType) {

    /**
     * Creates an error response with no diagnostic details.
     *
     * @param message user-facing error message
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null, null);
    }

    /**
     * Creates an error response including diagnostic details.
     *
     * @param message user-facing error message
     * @param details diagnostic details suitable for clients
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details, null);
    }
}

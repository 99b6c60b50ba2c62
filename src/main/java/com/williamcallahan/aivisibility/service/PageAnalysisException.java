package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import java.util.OptionalInt;

/**
 * Signals that analyzing a page failed.
 *
 * <p>Analyzers attach the HTTP status of the fetched page when one is known so the failure can be
 * classified without parsing messages. Single-page analysis rethrows classified failures with
 * their {@link PageErrorType}.</p>
 */
public class PageAnalysisException extends RuntimeException {

    private static final int NO_STATUS = -1;

    private final int httpStatus;
    private final PageErrorType errorType;

    /**
     * Creates an unclassified analysis failure.
     *
     * @param message explanation of the failure
     */
    public PageAnalysisException(String message) {
        this(message, null, NO_STATUS, null);
    }

    /**
     * Creates an unclassified analysis failure with its cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception
     */
    public PageAnalysisException(String message, Throwable cause) {
        this(message, cause, NO_STATUS, null);
    }

    /**
     * Creates a failure caused by an HTTP error response from the analyzed site.
     *
     * @param message explanation of the failure
     * @param cause underlying exception
     * @param httpStatus status code returned by the site
     */
    public PageAnalysisException(String message, Throwable cause, int httpStatus) {
        this(message, cause, httpStatus, null);
    }

    /**
     * Creates an already classified failure.
     *
     * @param errorType classification
     * @param message user-facing message
     * @param cause underlying exception
     */
    public PageAnalysisException(PageErrorType errorType, String message, Throwable cause) {
        this(message, cause, NO_STATUS, errorType);
    }

    private PageAnalysisException(String message, Throwable cause, int httpStatus, PageErrorType errorType) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.errorType = errorType;
    }

    /**
     * Returns the HTTP status reported by the analyzed site, if any.
     *
     * @return status code or empty
     */
    public OptionalInt httpStatus() {
        return httpStatus == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(httpStatus);
    }

    /**
     * Returns the classification attached to this failure, or null when unclassified.
     *
     * @return error type or null
     */
    public PageErrorType errorType() {
        return errorType;
    }
}

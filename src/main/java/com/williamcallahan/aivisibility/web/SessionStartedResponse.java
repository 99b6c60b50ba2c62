package com.williamcallahan.aivisibility.web;

/**
 * Response returned once a multi-page analysis has been accepted.
 *
 * @param sessionId identifier to poll
 * @param status always "started"
 * @param message confirmation text
 * @param totalPages number of pages queued
 */
public record SessionStartedResponse(String sessionId, String status, String message, int totalPages) {
    static final String STARTED_MESSAGE = "Multi-page analysis started successfully";

    static SessionStartedResponse started(String sessionId, int totalPages) {
        return new SessionStartedResponse(sessionId, "started", STARTED_MESSAGE, totalPages);
    }
}

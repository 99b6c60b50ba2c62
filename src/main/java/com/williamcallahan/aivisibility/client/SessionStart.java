package com.williamcallahan.aivisibility.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Server acknowledgement of a started multi-page analysis.
 *
 * @param sessionId identifier to poll
 * @param status "started"
 * @param message confirmation text
 * @param totalPages number of pages queued
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionStart(String sessionId, String status, String message, int totalPages) {}

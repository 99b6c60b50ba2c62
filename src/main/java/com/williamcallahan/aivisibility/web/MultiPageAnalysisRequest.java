package com.williamcallahan.aivisibility.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request body for starting a multi-page analysis.
 *
 * @param domain absolute http(s) URL of the site
 * @param paths page paths to analyze, in order
 */
public record MultiPageAnalysisRequest(@NotBlank String domain, @NotEmpty List<String> paths) {}

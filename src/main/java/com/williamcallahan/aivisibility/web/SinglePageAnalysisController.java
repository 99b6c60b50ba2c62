package com.williamcallahan.aivisibility.web;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.service.PageAnalysisException;
import com.williamcallahan.aivisibility.service.SinglePageAnalysisService;
import jakarta.validation.Valid;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous single-page analysis, served from the result cache when possible.
 */
@RestController
@RequestMapping("/api/analyze")
public class SinglePageAnalysisController extends BaseController {

    private final SinglePageAnalysisService singlePageAnalysisService;

    public SinglePageAnalysisController(
            SinglePageAnalysisService singlePageAnalysisService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.singlePageAnalysisService = singlePageAnalysisService;
    }

    @PostMapping
    public ResponseEntity<?> analyze(@Valid @RequestBody SinglePageAnalysisRequest request) {
        String url;
        try {
            url = requireHttpUrl(request.url());
        } catch (IllegalArgumentException invalidUrl) {
            return handleValidationException(invalidUrl);
        }
        try {
            return ResponseEntity.ok(singlePageAnalysisService.analyze(url, request.shouldBypassCache()));
        } catch (PageAnalysisException analysisFailure) {
            PageErrorType errorType = analysisFailure.errorType();
            HttpStatus status = errorType == PageErrorType.TIMEOUT ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
            return exceptionBuilder.buildAnalysisErrorResponse(status, analysisFailure.getMessage(), errorType);
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException invalidBody) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "URL is required");
    }

    private static String requireHttpUrl(String rawUrl) {
        String trimmed = rawUrl.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null) {
                return trimmed;
            }
        } catch (URISyntaxException invalidUri) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, invalidUri);
        }
        throw new IllegalArgumentException("URL must be an absolute http or https URL: " + trimmed);
    }
}

package com.williamcallahan.aivisibility.web;

import com.williamcallahan.aivisibility.domain.analysis.SessionSnapshot;
import com.williamcallahan.aivisibility.service.AnalysisCapacityException;
import com.williamcallahan.aivisibility.service.MultiPageOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts multi-page analyses and serves their progress snapshots.
 */
@RestController
@RequestMapping("/api/analyze-multi-page")
public class MultiPageAnalysisController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(MultiPageAnalysisController.class);

    static final String SESSION_NOT_FOUND_MESSAGE = "Session not found or expired";

    private final MultiPageOrchestrator orchestrator;

    public MultiPageAnalysisController(MultiPageOrchestrator orchestrator, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<?> startAnalysis(@Valid @RequestBody MultiPageAnalysisRequest request) {
        try {
            MultiPageOrchestrator.StartedSession started =
                    orchestrator.startSession(request.domain(), request.paths());
            return ResponseEntity.ok(SessionStartedResponse.started(started.sessionId(), started.totalPages()));
        } catch (IllegalArgumentException invalidRequest) {
            log.debug("Rejected multi-page analysis request: {}", invalidRequest.getMessage());
            return handleValidationException(invalidRequest);
        } catch (AnalysisCapacityException saturated) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, saturated.getMessage());
        }
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<?> getProgress(@PathVariable("sessionId") String sessionId) {
        return orchestrator.getSnapshot(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, SESSION_NOT_FOUND_MESSAGE));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException invalidBody) {
        String details = invalidBody.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .reduce((left, right) -> left + ", " + right)
                .orElse(null);
        return ResponseEntity.badRequest().body(ApiErrorResponse.error("Invalid analysis request", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed analysis request");
    }
}

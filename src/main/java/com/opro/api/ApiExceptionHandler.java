package com.opro.api;

import com.opro.optimization.error.GenerationFailure;
import com.opro.optimization.error.GradingFailure;
import com.opro.optimization.error.IllegalTransitionFailure;
import com.opro.optimization.error.IncompleteStepFailure;
import com.opro.optimization.error.InvalidConfigFailure;
import com.opro.optimization.error.NotFoundFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps optimization failures to HTTP statuses with a {@code {success:false, error, message}} body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundFailure.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundFailure ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler({IllegalTransitionFailure.class, IncompleteStepFailure.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex) {
        return respond(HttpStatus.CONFLICT,
                ex instanceof IncompleteStepFailure ? "incomplete_step" : "illegal_transition", ex.getMessage());
    }

    @ExceptionHandler(InvalidConfigFailure.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfig(InvalidConfigFailure ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.of("invalid_config", ex.getMessage(), ex.getViolations()));
    }

    @ExceptionHandler(GenerationFailure.class)
    public ResponseEntity<ErrorResponse> handleGeneration(GenerationFailure ex) {
        log.warn("Generation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Failed to generate prompts", ex.getMessage());
    }

    @ExceptionHandler(GradingFailure.class)
    public ResponseEntity<ErrorResponse> handleGrading(GradingFailure ex) {
        log.warn("Scoring failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Failed to score prompt", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("validation_failed", "Request validation failed", details));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message));
    }
}

package com.consensushub.api;

import com.consensushub.contract.ValidationException;
import com.consensushub.governance.GovernanceUnavailableException;
import com.consensushub.store.IllegalTransitionException;
import com.consensushub.store.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "VALIDATION_FAILED",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        Map<String, Object> body = errorResponse("VALIDATION_FAILED", ex.getMessage());
        if (ex.getNodeId() != null) {
            body.put("node_id", ex.getNodeId());
        }
        return body;
    }

    @ExceptionHandler(ConsensusNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ConsensusNotFoundException ex) {
        return errorResponse("CONSENSUS_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleIllegalTransition(IllegalTransitionException ex) {
        log.warn("Rejected lifecycle update: {}", ex.getMessage());
        return errorResponse("ILLEGAL_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler(GovernanceUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleGovernanceUnavailable(GovernanceUnavailableException ex) {
        log.warn("Governance unavailable: {}", ex.getMessage());
        return errorResponse("GOVERNANCE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handlePersistence(PersistenceException ex) {
        log.error("Persistence failure", ex);
        return errorResponse("PERSISTENCE_FAILURE", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}

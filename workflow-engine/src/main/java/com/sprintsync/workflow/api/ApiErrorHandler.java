package com.sprintsync.workflow.api;

import com.sprintsync.workflow.api.dto.ErrorResponse;
import com.sprintsync.workflow.error.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

/**
 * Maps engine exceptions to HTTP responses with a uniform {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class ApiErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ErrorResponse> handleWorkflow(WorkflowException ex, WebRequest request) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request {} failed: {}", pathOf(request), ex.getMessage());
        }
        return build(status, ex.getKind().name().toLowerCase(), ex.retryable(), ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "invalid_argument", false, ex.getMessage(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MissingServletRequestParameterException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "malformed_request", false, ex.getMessage(), request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, WebRequest request) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.valueOf(code.value());
        return build(status, status.name().toLowerCase(), false, ex.getReason(), request);
    }

    static HttpStatus statusFor(WorkflowException.Kind kind) {
        return switch (kind) {
            case DUPLICATE_NAME, DUPLICATE_EDGE, DUPLICATE_ORGANIZATION,
                 CONCURRENT_MODIFICATION -> HttpStatus.CONFLICT;
            case CROSS_ORG_REFERENCE, INACTIVE_STATUS, ILLEGAL_TRANSITION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ORGANIZATION_NOT_FOUND, TASK_NOT_FOUND, UNKNOWN_STATUS,
                 TRANSITION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PERSISTENCE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, boolean retryable,
                                                String message, WebRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(),
                status.getReasonPhrase(), code, retryable, message, pathOf(request));
        return ResponseEntity.status(status).body(body);
    }

    private static String pathOf(WebRequest request) {
        if (request instanceof ServletWebRequest servletRequest) {
            return servletRequest.getRequest().getRequestURI();
        }
        return null;
    }
}

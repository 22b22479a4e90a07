package com.sporetrack.controller.rest;

import com.sporetrack.service.core.error.MissingTenantException;
import com.sporetrack.service.core.error.ObservationNotFoundException;
import com.sporetrack.service.core.error.PhaseUnresolvedException;
import com.sporetrack.service.core.error.SyncPropagationException;
import com.sporetrack.service.core.error.TenantScopeViolationException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@ControllerAdvice
public class RestErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(RestErrorHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("request body");
        return build(HttpStatus.BAD_REQUEST, "Validation failed: " + detail, request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorPayload> handleBadParameter(Exception ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler({MissingTenantException.class, PhaseUnresolvedException.class})
    public ResponseEntity<ErrorPayload> handleUnprocessable(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request);
    }

    @ExceptionHandler(TenantScopeViolationException.class)
    public ResponseEntity<ErrorPayload> handleForbidden(TenantScopeViolationException ex, WebRequest request) {
        log.warn("Rejected cross-tenant access: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Resource is outside the caller's tenant", request);
    }

    @ExceptionHandler(ObservationNotFoundException.class)
    public ResponseEntity<ErrorPayload> handleNotFound(ObservationNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(SyncPropagationException.class)
    public ResponseEntity<ErrorPayload> handleUnavailable(SyncPropagationException ex, WebRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
        return ResponseEntity.status(status).body(body);
    }
}

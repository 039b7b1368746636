package com.influxgate.controller.rest;

import com.influxgate.core.error.BackendAuthException;
import com.influxgate.core.error.BackendConnectionException;
import com.influxgate.core.error.BackendQueryException;
import com.influxgate.core.error.BackendTimeoutException;
import com.influxgate.core.error.InvalidQueryInputException;
import com.influxgate.core.error.InvalidResourceUriException;
import com.influxgate.core.error.UnknownVersionException;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/**
 * Maps the engine's error taxonomy to HTTP statuses. Connection and timeout failures carry a
 * {@code Retry-After} header; everything else is final.
 */
@Slf4j
@ControllerAdvice
public class RestErrorHandler {

    private final Clock clock;

    public RestErrorHandler() {
        this(Clock.systemUTC());
    }

    public RestErrorHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler({
        InvalidQueryInputException.class,
        InvalidResourceUriException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorPayload> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        FieldError first = ex.getBindingResult().getFieldError();
        String message = first == null ? "Validation failed" : first.getField() + " " + first.getDefaultMessage();
        return build(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorPayload> handleMissingParameter(
            MissingServletRequestParameterException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getParameterName() + " is required", request);
    }

    @ExceptionHandler(BackendAuthException.class)
    public ResponseEntity<ErrorPayload> handleAuth(BackendAuthException ex, WebRequest request) {
        log.warn("InfluxDB authentication failed: {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownVersionException.class)
    public ResponseEntity<ErrorPayload> handleUnknownVersion(UnknownVersionException ex, WebRequest request) {
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), request);
    }

    @ExceptionHandler(BackendQueryException.class)
    public ResponseEntity<ErrorPayload> handleQuery(BackendQueryException ex, WebRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request);
    }

    @ExceptionHandler(BackendConnectionException.class)
    public ResponseEntity<ErrorPayload> handleConnection(BackendConnectionException ex, WebRequest request) {
        log.warn("InfluxDB unreachable: {}", ex.getMessage());
        return retryable(build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request));
    }

    @ExceptionHandler(BackendTimeoutException.class)
    public ResponseEntity<ErrorPayload> handleTimeout(BackendTimeoutException ex, WebRequest request) {
        log.warn("InfluxDB timed out: {}", ex.getMessage());
        return retryable(build(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), request));
    }

    private static ResponseEntity<ErrorPayload> retryable(ResponseEntity<ErrorPayload> response) {
        return ResponseEntity.status(response.getStatusCode())
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(response.getBody());
    }

    private ResponseEntity<ErrorPayload> build(HttpStatus status, String message, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body = new ErrorPayload(Instant.now(clock), status.value(), status.getReasonPhrase(), message, path);
        return ResponseEntity.status(status).body(body);
    }
}

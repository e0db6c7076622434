package com.riskcast.backend.exception;

import com.riskcast.backend.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_INPUT, Stage.VALIDATION, "Validation failed",
                details, null, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<String> details = ex.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_INPUT, Stage.VALIDATION, "Validation failed",
                details, null, request, ex);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_INPUT, Stage.VALIDATION, "Malformed request body",
                List.of(), null, request, ex);
    }

    @ExceptionHandler(ValidationInputException.class)
    public ResponseEntity<ApiError> handleInput(ValidationInputException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ex, List.of(), null, request);
    }

    @ExceptionHandler(ResourceExhaustedException.class)
    public ResponseEntity<ApiError> handleExhausted(ResourceExhaustedException ex, HttpServletRequest request) {
        return buildError(HttpStatus.TOO_MANY_REQUESTS, ex, List.of(), null, request);
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiError> handleCircuitOpen(CircuitOpenException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ex, List.of(), ex.getRetryAfter(), request);
    }

    @ExceptionHandler(RequestCancelledException.class)
    public ResponseEntity<ApiError> handleCancelled(RequestCancelledException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ex, List.of(), null, request);
    }

    @ExceptionHandler(EngineTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(EngineTimeoutException ex, HttpServletRequest request) {
        return buildError(HttpStatus.GATEWAY_TIMEOUT, ex, List.of(), null, request);
    }

    @ExceptionHandler(ModelInvocationException.class)
    public ResponseEntity<ApiError> handleModel(ModelInvocationException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_GATEWAY, ex, List.of(), null, request);
    }

    @ExceptionHandler(ValidationTargetNotMetException.class)
    public ResponseEntity<ApiError> handleTargets(ValidationTargetNotMetException ex, HttpServletRequest request) {
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getFailedTargets(), null, request);
    }

    @ExceptionHandler(RiskEngineException.class)
    public ResponseEntity<ApiError> handleEngine(RiskEngineException ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ex, List.of(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, null, null, "Unexpected error", List.of(), null, request, ex);
    }

    private String toDetail(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, RiskEngineException ex, List<String> details,
                                                Instant retryAfter, HttpServletRequest request) {
        return buildError(status, ex.getErrorCode(), ex.getStage(), ex.getMessage(), details, retryAfter, request, ex);
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, ErrorCode errorCode, Stage stage, String message,
                                                List<String> details, Instant retryAfter,
                                                HttpServletRequest request, Exception ex) {
        Instant now = Instant.now();
        ApiError error = ApiError.builder()
                .timestamp(now)
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode != null ? errorCode.name() : status.name())
                .stage(stage != null ? stage.name() : null)
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .retryAfter(retryAfter)
                .details(details == null || details.isEmpty() ? null : details)
                .build();
        if (status.is5xxServerError() && errorCode == null) {
            log.error("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        } else {
            log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (retryAfter != null) {
            long seconds = Math.max(1, Duration.between(now, retryAfter).toSeconds());
            response.header(HttpHeaders.RETRY_AFTER, Long.toString(seconds));
        }
        return response.body(error);
    }
}

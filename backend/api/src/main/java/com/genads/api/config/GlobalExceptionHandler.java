package com.genads.api.config;

import com.genads.common.dto.ApiResponse;
import com.genads.common.exception.ApiException;
import com.genads.common.exception.ErrorCode;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Converts every failure into an error {@link ApiResponse}.
 * Client errors are logged at WARN, server faults at ERROR with a stack trace.
 * Each response message ends with a short request id that also appears in the log.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        String requestId = generateRequestId();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] {} ({}) at {}: {}", requestId, errorCode.getCode(), errorCode.name(),
                    request.getDescription(false), e.getMessage(), e);
        } else {
            log.warn("[{}] {} ({}) at {}: {}", requestId, errorCode.getCode(), errorCode.name(),
                    request.getDescription(false), e.getMessage());
        }

        return respond(errorCode.getStatus(), errorCode, e.getMessage(), requestId);
    }

    /**
     * {@code @Valid} request body failures.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleBodyValidation(MethodArgumentNotValidException e, WebRequest request) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .sorted()
                .collect(Collectors.joining(", "));
        return clientError("Validation failed: " + detail, request);
    }

    /**
     * Constraint annotations on {@code @RequestParam}/{@code @PathVariable}.
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleParameterValidation(HandlerMethodValidationException e, WebRequest request) {
        String detail = e.getAllValidationResults().stream()
                .map(result -> result.getMethodParameter().getParameterName() + ": "
                        + result.getResolvableErrors().stream()
                                .map(error -> error.getDefaultMessage())
                                .collect(Collectors.joining("; ")))
                .collect(Collectors.joining(", "));
        return clientError("Validation failed: " + detail, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException e, WebRequest request) {
        String detail = e.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        return clientError("Validation failed: " + detail, request);
    }

    /**
     * Malformed JSON, wrong primitive types, unknown enum values.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e, WebRequest request) {
        String cause = e.getMostSpecificCause().getMessage();
        return clientError("Malformed request body: " + firstLine(cause), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(DataAccessException e, WebRequest request) {
        ErrorCode errorCode = isStoreUnavailable(e) ? ErrorCode.STORE_UNAVAILABLE : ErrorCode.INTERNAL_SERVER_ERROR;
        String requestId = generateRequestId();
        log.error("[{}] {} at {}: {}", requestId, errorCode.name(), request.getDescription(false), e.getMessage(), e);
        return respond(errorCode.getStatus(), errorCode, errorCode.getMessage(), requestId);
    }

    /**
     * Framework errors that already carry a status (missing parameter or part,
     * unsupported method, unknown static resource) keep it.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = errorResponse.getStatusCode();
            ErrorCode errorCode = status.value() == HttpStatus.NOT_FOUND.value() ? ErrorCode.NOT_FOUND : ErrorCode.INVALID_REQUEST;
            log.warn("[{}] {} at {}: {}", requestId, status, request.getDescription(false), e.getMessage());
            String detail = errorResponse.getBody().getDetail();
            return respond(status, errorCode, detail != null ? detail : errorCode.getMessage(), requestId);
        }

        log.error("[{}] Unexpected {} at {}: {}", requestId, e.getClass().getName(),
                request.getDescription(false), e.getMessage(), e);
        return respond(ErrorCode.INTERNAL_SERVER_ERROR.getStatus(), ErrorCode.INTERNAL_SERVER_ERROR,
                ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), requestId);
    }

    static boolean isStoreUnavailable(Throwable e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof DataAccessResourceFailureException
                    || current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private ResponseEntity<ApiResponse<Void>> clientError(String message, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] {} at {}: {}", requestId, ErrorCode.INVALID_REQUEST.getCode(), request.getDescription(false), message);
        return respond(ErrorCode.INVALID_REQUEST.getStatus(), ErrorCode.INVALID_REQUEST, message, requestId);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatusCode status, ErrorCode errorCode, String message, String requestId) {
        return ResponseEntity
                .status(status)
                .body(ApiResponse.error(errorCode, String.format("%s [%s]", message, requestId)));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private String firstLine(String message) {
        if (message == null) return "unreadable";
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    /**
     * Short id correlating a response with its log line.
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}

package com.flagship.gold_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP responses with a consistent {@link ApiError} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header", null,
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", null, "Request body could not be parsed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", null,
            "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", null, "Request validation failed", errors);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ApiError> handleAuthorization(AuthorizationException e) {
        log.warn("Authorization failed: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ComplianceException.class)
    public ResponseEntity<ApiError> handleCompliance(ComplianceException e) {
        log.warn("Compliance check failed: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Compliance Violation", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler({DuplicateException.class, InvalidStateException.class})
    public ResponseEntity<ApiError> handleConflict(GoldLedgerException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler({InsufficientBalanceException.class, MemberNotActiveException.class})
    public ResponseEntity<ApiError> handleUnprocessable(GoldLedgerException e) {
        log.warn("Rejected: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", null, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String code,
                                             String message, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}

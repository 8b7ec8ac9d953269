package com.stellar.gateway.api;

import com.stellar.gateway.core.StellarTransactionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Centralized error handling. Every error body has the shape
 * {@code {"success": false, "error": "..."}}: 400 for caller mistakes, 500 for anything
 * the SDK or Horizon reports.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .filter(m -> m != null && !m.isBlank())
                .findFirst()
                .orElse(StellarTransactionService.MISSING_PARAMETERS);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, missingBodyMessage(request));
    }

    /**
     * A body sent without a JSON content type cannot be read, so it counts as an empty body.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        log.debug("Unsupported content type {} on {}", ex.getContentType(), request.getRequestURI());
        return error(HttpStatus.BAD_REQUEST, missingBodyMessage(request));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(LedgerGatewayException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerGateway(LedgerGatewayException ex) {
        log.error("Ledger operation failed: {}", ex.getMessage(), ex.getCause());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, getMessageOrCause(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // Spring MVC's own failures (unknown route, wrong method) keep their status.
            ErrorResponse errorResponse = (ErrorResponse) ex;
            return ResponseEntity
                    .status(errorResponse.getStatusCode())
                    .body(Map.of("success", false, "error", getMessageOrCause(ex)));
        }
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, getMessageOrCause(ex));
    }

    private static String missingBodyMessage(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri != null && uri.endsWith("/submit-transaction")
                ? StellarTransactionService.MISSING_XDR
                : StellarTransactionService.MISSING_PARAMETERS;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity
                .status(status)
                .body(Map.of("success", false, "error", message));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}

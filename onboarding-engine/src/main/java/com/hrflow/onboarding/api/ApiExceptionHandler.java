package com.hrflow.onboarding.api;

import com.hrflow.onboarding.engine.ErrorCode;
import com.hrflow.onboarding.engine.OnboardingException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Turns engine errors into {@link ErrorResponse} bodies.
 *
 * VALIDATION_ERROR → 400, NOT_FOUND / TEMPLATE_NOT_FOUND → 404,
 * INVALID_TRANSITION / DUPLICATE_WORKFLOW → 409, PERSISTENCE_ERROR → 503.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OnboardingException.class)
    public ResponseEntity<ErrorResponse> handleOnboarding(OnboardingException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        } else {
            log.debug("{} {} rejected with {}: {}",
                    request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        }
        return build(ex.getCode(), ex.getMessage(), status, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        log.debug("Malformed request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return build(ErrorCode.VALIDATION_ERROR, "Malformed or missing request body",
                HttpStatus.BAD_REQUEST, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return build(ErrorCode.VALIDATION_ERROR, "Invalid value for '" + ex.getName() + "'",
                HttpStatus.BAD_REQUEST, request);
    }

    // Raised by the transaction proxy outside the engine method: the connection
    // could not be obtained on begin, or the commit itself failed.
    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<ErrorResponse> handleTransactionFailure(TransactionException ex,
                                                                  HttpServletRequest request) {
        log.error("Transaction failed for {} {}", request.getMethod(), request.getRequestURI(), ex);
        return build(ErrorCode.PERSISTENCE_ERROR, "Could not save changes; nothing was applied",
                HttpStatus.SERVICE_UNAVAILABLE, request);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR                       -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND, TEMPLATE_NOT_FOUND          -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, DUPLICATE_WORKFLOW -> HttpStatus.CONFLICT;
            case PERSISTENCE_ERROR                      -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ErrorResponse> build(ErrorCode code, String message,
                                                       HttpStatus status, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(code, message, status.value(), Instant.now(),
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}

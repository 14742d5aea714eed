package com.comma.counseling.controller;

import com.comma.counseling.dto.ErrorResponse;
import com.comma.counseling.exceptions.ConflictException;
import com.comma.counseling.exceptions.CounselingException;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidCredentialException;
import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.exceptions.NotFoundException;
import com.comma.counseling.exceptions.RateLimitException;
import com.comma.counseling.exceptions.UnavailableException;
import com.comma.counseling.exceptions.ValidationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(CounselingException.class)
    public ResponseEntity<ErrorResponse> handleCounselingException(CounselingException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Unmapped domain exception: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected: code={}, message={}", e.getCode(), e.getMessage());
        }
        return body(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal Server Error");
    }

    static HttpStatus statusOf(CounselingException e) {
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof ForbiddenException) return HttpStatus.FORBIDDEN;
        if (e instanceof InvalidTransitionException) return HttpStatus.CONFLICT;
        if (e instanceof ConflictException) return HttpStatus.CONFLICT;
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof UnavailableException) return HttpStatus.CONFLICT;
        if (e instanceof InvalidCredentialException) return HttpStatus.UNAUTHORIZED;
        if (e instanceof RateLimitException) return HttpStatus.TOO_MANY_REQUESTS;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), code, message, clock.instant()));
    }
}

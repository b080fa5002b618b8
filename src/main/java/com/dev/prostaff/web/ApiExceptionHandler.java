package com.dev.prostaff.web;

import com.dev.prostaff.security.SessionAuthenticationException;
import com.dev.prostaff.tenant.TenantMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({
            ResourceNotFoundException.class,
            BadRequestException.class,
            ForbiddenOperationException.class
    })
    public ResponseEntity<Map<String, Object>> handleRuntime(RuntimeException ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        String code = "BAD_REQUEST";
        if (ex instanceof ResourceNotFoundException) {
            status = HttpStatus.NOT_FOUND;
            code = "NOT_FOUND";
        } else if (ex instanceof ForbiddenOperationException) {
            status = HttpStatus.FORBIDDEN;
            code = "FORBIDDEN";
        }
        return ResponseEntity.status(status).body(errorBody(status, code, ex.getMessage()));
    }

    @ExceptionHandler(SessionAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleSession(SessionAuthenticationException ex) {
        log.warn("Session rejected [{}]: {}", ex.errorCode(), ex.getMessage());
        HttpStatus status = HttpStatus.UNAUTHORIZED;
        return ResponseEntity.status(status).body(errorBody(status, ex.errorCode(), ex.getMessage()));
    }

    @ExceptionHandler(BadCredentialsException.class)
    public ResponseEntity<Map<String, Object>> handleBadCredentials(BadCredentialsException ex) {
        HttpStatus status = HttpStatus.UNAUTHORIZED;
        return ResponseEntity.status(status).body(errorBody(status, "INVALID_CREDENTIALS", "Invalid email or password"));
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTenantMismatch(TenantMismatchException ex) {
        log.error("Blocked cross-tenant access: {}", ex.getMessage());
        HttpStatus status = HttpStatus.FORBIDDEN;
        return ResponseEntity.status(status).body(errorBody(status, "FORBIDDEN", "Access denied"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(errorBody(status, "VALIDATION_ERROR", message));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(errorBody(status, "INVALID_PARAMETER", ex.getMessage()));
    }

    public static Map<String, Object> errorBody(HttpStatus status, String code, String message) {
        return Map.of(
                "timestamp", Instant.now().toString(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "code", code,
                "message", message != null ? message : status.getReasonPhrase()
        );
    }
}

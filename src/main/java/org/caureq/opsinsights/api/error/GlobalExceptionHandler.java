package org.caureq.opsinsights.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.service.InsufficientDataException;
import org.caureq.opsinsights.service.ProxmoxApiException;
import org.caureq.opsinsights.service.ResourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, HttpServletRequest req, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, req.getRequestURI(), req.getHeader("X-Correlation-Id"), details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fields = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", req, Map.of("fieldErrors", fields))
        );
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), req, Map.of())
        );
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, ex.getMessage(), req, Map.of())
        );
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficient(InsufficientDataException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(
                build(ErrorCode.INSUFFICIENT_DATA, ex.getMessage(), req,
                        Map.of("available", ex.available(), "required", ex.required()))
        );
    }

    @ExceptionHandler(ProxmoxApiException.class)
    public ResponseEntity<ApiError> handleProxmox(ProxmoxApiException ex, HttpServletRequest req) {
        log.warn("[Proxmox] upstream {} on {}", ex.status(), ex.path());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(ErrorCode.UPSTREAM_ERROR, ex.getMessage(), req, ex.payload())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), req, Map.of())
        );
    }
}

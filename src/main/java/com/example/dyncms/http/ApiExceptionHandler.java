package com.example.dyncms.http;

import com.example.dyncms.service.CmsException;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body", ex);
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, CmsException.Code.VALIDATION_FAILED.name(), message);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> mismatch(MethodArgumentTypeMismatchException ex) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(CmsException.class)
    public ResponseEntity<Map<String, Object>> domainError(CmsException ex) {
        HttpStatus status;
        switch (ex.getCode()) {
            case INVALID_DEFINITION, VALIDATION_FAILED -> status = HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> status = HttpStatus.NOT_FOUND;
            case CONFLICT -> status = HttpStatus.CONFLICT;
            case FORBIDDEN -> status = HttpStatus.FORBIDDEN;
            case UNAUTHENTICATED -> status = HttpStatus.UNAUTHORIZED;
            default -> status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return body(status, ex.getCode().name(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Routing failures such as unknown paths or unsupported methods.
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return body(status, status.name(), framework.getBody().getDetail());
        }
        log.error("Unexpected error handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("code", code, "message", message == null ? code : message));
    }
}

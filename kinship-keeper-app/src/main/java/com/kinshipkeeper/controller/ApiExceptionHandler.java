package com.kinshipkeeper.controller;

import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.service.RejectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns core rejections into HTTP responses: {"error": kind, "message": text}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String CONCURRENT_WRITE = "ConcurrentWrite";

    @ExceptionHandler(RejectionException.class)
    public ResponseEntity<Map<String, Object>> handleRejection(RejectionException e) {
        HttpStatus status = statusFor(e.getRejection());
        log.info("Rejected request ({}): {}", e.getRejection().code(), e.getMessage());
        return ResponseEntity.status(status).body(body(e.getRejection().code(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(body(Rejection.INVALID_PARAMETER.code(), "Invalid JSON"));
    }

    /**
     * A serialization failure at commit time, after the write itself went through.
     */
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentWrite(ConcurrencyFailureException e) {
        log.warn("Concurrent write conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(body(CONCURRENT_WRITE, "Another change to these records was saved first; retry the request"));
    }

    static HttpStatus statusFor(Rejection rejection) {
        return switch (rejection) {
            case OWNERSHIP_VIOLATION -> HttpStatus.FORBIDDEN;
            case INVALID_KINSHIP_TYPE, INVALID_PARAMETER, SELF_RELATION_NOT_ALLOWED,
                 DUPLICATE_PARENT_ROLE, DUPLICATE_RELATIONSHIP -> HttpStatus.BAD_REQUEST;
        };
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}

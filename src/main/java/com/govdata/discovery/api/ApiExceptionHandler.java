package com.govdata.discovery.api;

import com.govdata.discovery.catalog.DatasetNotFoundException;
import com.govdata.discovery.validation.InvalidRequestException;
import com.govdata.discovery.validation.RequestValidator.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value for parameter " + ex.getName();
        return error(HttpStatus.BAD_REQUEST, message, List.of(new ValidationError("INVALID_PARAMETER", message, ex.getName())));
    }

    @ExceptionHandler(DatasetNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(DatasetNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "Dataset not found", List.of());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        log.error("event=request_failed cause={}", ex.toString(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", List.of());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, List<ValidationError> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (!details.isEmpty()) {
            body.put("details", details);
        }
        return new ResponseEntity<>(body, status);
    }
}

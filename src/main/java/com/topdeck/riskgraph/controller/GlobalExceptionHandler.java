package com.topdeck.riskgraph.controller;

import com.topdeck.riskgraph.exception.GraphAccessException;
import com.topdeck.riskgraph.exception.InvalidConfigurationException;
import com.topdeck.riskgraph.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ResourceNotFoundException ex) {
        return body("RESOURCE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(GraphAccessException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleGraphAccess(GraphAccessException ex) {
        log.error("Graph store unavailable: {}", ex.getMessage());
        return body("GRAPH_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidInput(InvalidConfigurationException ex) {
        return body("INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body("VALIDATION_FAILED", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return body("MALFORMED_REQUEST", "Request body could not be read");
    }

    private static Map<String, Object> body(String code, String message) {
        return Map.of(
                "code", code,
                "message", message != null ? message : "",
                "timestamp", Instant.now().toString()
        );
    }
}

package com.architecture.memory.archscraper.controller;

import com.architecture.memory.archscraper.dto.ErrorResponse;
import com.architecture.memory.archscraper.exception.ArchitectureNotFoundException;
import com.architecture.memory.archscraper.exception.ConfigurationException;
import com.architecture.memory.archscraper.exception.ScraperException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.warn("Rejected scrape request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getCategory().name(), e.getMessage());
    }

    @ExceptionHandler(ArchitectureNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ArchitectureNotFoundException e) {
        return build(HttpStatus.NOT_FOUND, null, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, null, message);
    }

    @ExceptionHandler(ScraperException.class)
    public ResponseEntity<ErrorResponse> handleScraper(ScraperException e) {
        log.error("Scrape failed upstream: {}", e.getMessage());
        return build(HttpStatus.BAD_GATEWAY, e.getCategory().name(), e.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String category, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .category(category)
                .message(message)
                .timestamp(LocalDateTime.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}

package com.github.tubetune.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(MethodArgumentNotValidException e) {
        String field = e.getBindingResult().getFieldError() != null
                ? e.getBindingResult().getFieldError().getField()
                : "request";
        log.debug("Rejected request, invalid {}", field);
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid " + field));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body"));
    }
}

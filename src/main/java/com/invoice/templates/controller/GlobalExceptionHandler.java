package com.invoice.templates.controller;

import com.invoice.templates.exception.EmptyDocumentException;
import com.invoice.templates.exception.StoreEmptyException;
import com.invoice.templates.exception.TemplateEngineException;
import com.invoice.templates.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EmptyDocumentException.class)
    public ResponseEntity<ErrorResponse> emptyDocument(EmptyDocumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", List.of());
    }

    @ExceptionHandler(StoreEmptyException.class)
    public ResponseEntity<ErrorResponse> storeEmpty(StoreEmptyException e) {
        log.error("Template store unavailable: {}", e.getMessage());
        List<String> errors = e.getLoadErrors().stream()
                .map(error -> error.getPath() + ": " + error.getReason())
                .toList();
        return respond(HttpStatus.CONFLICT, e.getMessage(), errors);
    }

    @ExceptionHandler(TemplateEngineException.class)
    public ResponseEntity<ErrorResponse> engineFailure(TemplateEngineException e) {
        log.error("Extraction failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, List<String> errors) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .message(message)
                .errors(errors)
                .timestamp(LocalDateTime.now())
                .build());
    }
}

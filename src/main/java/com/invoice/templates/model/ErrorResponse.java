package com.invoice.templates.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class ErrorResponse {
    String message;
    List<String> errors;
    LocalDateTime timestamp;
}

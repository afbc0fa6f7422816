package com.invoice.templates.exception;

public class TemplateEngineException extends RuntimeException {

    public TemplateEngineException(String message) {
        super(message);
    }

    public TemplateEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.invoice.templates.exception;

/**
 * A single template document is malformed. The loader records it and moves on.
 */
public class TemplateValidationException extends TemplateEngineException {

    public TemplateValidationException(String message) {
        super(message);
    }

    public TemplateValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.invoice.templates.exception;

public class EmptyDocumentException extends TemplateEngineException {

    public EmptyDocumentException() {
        super("Document contains no extractable text");
    }
}

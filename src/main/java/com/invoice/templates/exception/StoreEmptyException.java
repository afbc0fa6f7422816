package com.invoice.templates.exception;

import com.invoice.templates.loader.LoadError;

import java.util.List;

/**
 * A load produced zero usable templates. The previously active store, if any,
 * stays in place.
 */
public class StoreEmptyException extends TemplateEngineException {

    private final List<LoadError> loadErrors;

    public StoreEmptyException(String message, List<LoadError> loadErrors) {
        super(message);
        this.loadErrors = List.copyOf(loadErrors);
    }

    public List<LoadError> getLoadErrors() {
        return loadErrors;
    }
}

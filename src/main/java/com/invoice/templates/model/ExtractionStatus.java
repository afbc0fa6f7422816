package com.invoice.templates.model;

public enum ExtractionStatus {
    COMPLETE,   // every required field found and valid
    PARTIAL,    // at least one required field missing or invalid
    NO_MATCH    // no template cleared the match threshold
}

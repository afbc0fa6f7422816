package com.invoice.templates.model;

import lombok.Data;

@Data
public class ExtractionRequest {

    /** Recognized document text. */
    private String text;

    /** Optional locale hint, e.g. "pl". */
    private String locale;

    /** Caller's reference for the document (file name, page range). */
    private String source;
}

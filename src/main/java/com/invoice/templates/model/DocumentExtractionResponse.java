package com.invoice.templates.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DocumentExtractionResponse {

    private ExtractionStatus status;
    private MatchCandidate match;
    private ExtractionResult result;
    private DuplicateKey duplicateKey;
    private List<String> missingFingerprintFields = new ArrayList<>();
    private boolean duplicate;
    private String duplicateOf;

    public static DocumentExtractionResponse noMatch() {
        DocumentExtractionResponse r = new DocumentExtractionResponse();
        r.status = ExtractionStatus.NO_MATCH;
        return r;
    }
}

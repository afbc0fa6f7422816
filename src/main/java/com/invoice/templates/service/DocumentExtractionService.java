package com.invoice.templates.service;

import com.invoice.templates.exception.EmptyDocumentException;
import com.invoice.templates.model.DocumentExtractionResponse;
import com.invoice.templates.model.DuplicateCheck;
import com.invoice.templates.model.ExtractionResult;
import com.invoice.templates.model.FingerprintOutcome;
import com.invoice.templates.model.MatchCandidate;
import com.invoice.templates.template.TemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Orchestrates: match the text against the active store, extract with the
 * winning template, then fingerprint and look the result up for duplicates.
 */
@Service
@Slf4j
public class DocumentExtractionService {

    private final TemplateRegistry registry;
    private final TemplateMatcher matcher;
    private final TemplateExtractionEngine engine;
    private final DuplicateFingerprinter fingerprinter;
    private final DuplicateRegistryService duplicates;

    public DocumentExtractionService(TemplateRegistry registry,
                                     TemplateMatcher matcher,
                                     TemplateExtractionEngine engine,
                                     DuplicateFingerprinter fingerprinter,
                                     DuplicateRegistryService duplicates) {
        this.registry = registry;
        this.matcher = matcher;
        this.engine = engine;
        this.fingerprinter = fingerprinter;
        this.duplicates = duplicates;
    }

    public DocumentExtractionResponse process(String text, String localeHint, String sourceRef) {
        if (text == null || text.isBlank()) {
            throw new EmptyDocumentException();
        }
        log.info("Processing document {} ({} chars, locale hint: {})", sourceRef, text.length(), localeHint);

        // One snapshot for the whole request, even if a reload happens meanwhile
        TemplateStore store = registry.current();

        Optional<MatchCandidate> match = matcher.match(text, localeHint, store);
        if (match.isEmpty()) {
            return DocumentExtractionResponse.noMatch();
        }

        MatchCandidate candidate = match.get();
        ExtractionResult result = engine.extract(text, candidate.getTemplate());

        DocumentExtractionResponse response = new DocumentExtractionResponse();
        response.setStatus(result.getStatus());
        response.setMatch(candidate);
        response.setResult(result);

        FingerprintOutcome fingerprint = fingerprinter.fingerprint(result);
        if (!fingerprint.isComplete()) {
            log.debug("No duplicate key for {}: missing {}", sourceRef, fingerprint.getMissingFields());
            response.setMissingFingerprintFields(fingerprint.getMissingFields());
            return response;
        }

        response.setDuplicateKey(fingerprint.getKey());
        response.setMissingFingerprintFields(List.of());
        DuplicateCheck check = duplicates.register(fingerprint.getKey(), candidate.getTemplateId(), sourceRef);
        response.setDuplicate(check.isDuplicate());
        response.setDuplicateOf(check.getFirstSourceRef());
        return response;
    }
}

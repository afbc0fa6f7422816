package com.invoice.templates.service;

import com.invoice.templates.entity.DocumentFingerprint;
import com.invoice.templates.model.DuplicateCheck;
import com.invoice.templates.model.DuplicateKey;
import com.invoice.templates.repository.DocumentFingerprintRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
@Slf4j
public class DuplicateRegistryService {

    private final DocumentFingerprintRepository repository;
    private final Clock clock;

    public DuplicateRegistryService(DocumentFingerprintRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Records the key if it is new. A known key is reported as a duplicate of
     * its first sighting and left unchanged.
     */
    public DuplicateCheck register(DuplicateKey key, String templateId, String sourceRef) {
        Optional<DocumentFingerprint> known = repository.findByDigest(key.getDigest());
        if (known.isPresent()) {
            return duplicateOf(key, known.get());
        }

        DocumentFingerprint fingerprint = DocumentFingerprint.builder()
                .digest(key.getDigest())
                .compositeKey(key.getValue())
                .templateId(templateId)
                .sourceRef(sourceRef)
                .firstSeenAt(clock.instant())
                .build();
        try {
            repository.saveAndFlush(fingerprint);
        } catch (DataIntegrityViolationException e) {
            // Registered concurrently by another request
            log.debug("Fingerprint {} inserted concurrently", key.getDigest());
            return repository.findByDigest(key.getDigest())
                    .map(first -> duplicateOf(key, first))
                    .orElseThrow(() -> e);
        }
        log.debug("Registered fingerprint {} for {}", key.getDigest(), sourceRef);
        return new DuplicateCheck(false, null, fingerprint.getFirstSeenAt());
    }

    private DuplicateCheck duplicateOf(DuplicateKey key, DocumentFingerprint first) {
        log.info("Duplicate document {} (first seen in {} at {})", key.getValue(), first.getSourceRef(), first.getFirstSeenAt());
        return new DuplicateCheck(true, first.getSourceRef(), first.getFirstSeenAt());
    }
}

package com.invoice.templates.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Either a duplicate key or the list of components that were missing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FingerprintOutcome {

    DuplicateKey key;
    List<String> missingFields;

    public static FingerprintOutcome of(DuplicateKey key) {
        return new FingerprintOutcome(key, List.of());
    }

    public static FingerprintOutcome incomplete(List<String> missingFields) {
        return new FingerprintOutcome(null, List.copyOf(missingFields));
    }

    public boolean isComplete() {
        return key != null;
    }

    public Optional<DuplicateKey> asOptional() {
        return Optional.ofNullable(key);
    }
}

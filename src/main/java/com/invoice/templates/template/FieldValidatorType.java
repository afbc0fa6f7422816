package com.invoice.templates.template;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Checksum validators a field rule can request by name in a template document.
 */
public enum FieldValidatorType {
    NIP,    // Polish fiscal id, weighted mod 11
    CUI,    // Romanian fiscal id, weighted mod 11
    IBAN;   // bank account, mod 97

    public static Optional<FieldValidatorType> fromKey(String key) {
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.name().equals(normalized))
                .findFirst();
    }
}

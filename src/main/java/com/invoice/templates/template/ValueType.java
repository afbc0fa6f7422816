package com.invoice.templates.template;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ValueType {
    TEXT, DATE, AMOUNT, INTEGER;

    public static Optional<ValueType> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.of(TEXT);
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.name().equals(normalized))
                .findFirst();
    }
}

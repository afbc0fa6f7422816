package com.invoice.templates.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Verdict of a field validator: the normalized form on success, the original
 * input and a reason on failure.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationOutcome {

    boolean valid;
    String normalized;
    String reason;

    public static ValidationOutcome valid(String normalized) {
        return new ValidationOutcome(true, normalized, null);
    }

    public static ValidationOutcome invalid(String original, String reason) {
        return new ValidationOutcome(false, original, reason);
    }
}

package com.invoice.templates.template;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives a field from other extracted fields when none of its patterns match.
 *
 * use_issue_date            the issue date
 * add_days:N                issue date plus N days
 * calculate_from_gross:R    gross / (1 + R/100), the net amount at VAT rate R
 * calculate_difference      gross minus net
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldFallback {

    public enum Kind {
        USE_ISSUE_DATE(ValueType.DATE),
        ADD_DAYS(ValueType.DATE),
        CALCULATE_FROM_GROSS(ValueType.AMOUNT),
        CALCULATE_DIFFERENCE(ValueType.AMOUNT);

        private final ValueType produces;

        Kind(ValueType produces) {
            this.produces = produces;
        }

        public ValueType produces() {
            return produces;
        }
    }

    Kind kind;

    /** Days for ADD_DAYS, otherwise 0. */
    int days;

    /** VAT rate in percent for CALCULATE_FROM_GROSS, otherwise null. */
    BigDecimal rate;

    /**
     * Reads a fallback expression; empty when it is not one of the known forms.
     */
    public static Optional<FieldFallback> fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        int colon = normalized.indexOf(':');
        String name = colon < 0 ? normalized : normalized.substring(0, colon).trim();
        String argument = colon < 0 ? null : normalized.substring(colon + 1).trim();

        try {
            return switch (name) {
                case "use_issue_date" -> argument == null
                        ? Optional.of(new FieldFallback(Kind.USE_ISSUE_DATE, 0, null))
                        : Optional.empty();
                case "calculate_difference" -> argument == null
                        ? Optional.of(new FieldFallback(Kind.CALCULATE_DIFFERENCE, 0, null))
                        : Optional.empty();
                case "add_days" -> argument == null
                        ? Optional.empty()
                        : Optional.of(new FieldFallback(Kind.ADD_DAYS, Integer.parseInt(argument), null));
                case "calculate_from_gross" -> rate(argument)
                        .map(r -> new FieldFallback(Kind.CALCULATE_FROM_GROSS, 0, r));
                default -> Optional.empty();
            };
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> rate(String argument) {
        if (argument == null) {
            return Optional.empty();
        }
        BigDecimal rate = new BigDecimal(argument);
        return rate.signum() < 0 ? Optional.empty() : Optional.of(rate);
    }
}

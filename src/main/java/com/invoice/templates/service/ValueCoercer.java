package com.invoice.templates.service;

import com.invoice.templates.template.AmountFormat;
import com.invoice.templates.template.DateFormats;
import com.invoice.templates.template.FieldRule;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a raw capture into the typed value its rule declares.
 */
@Component
public class ValueCoercer {

    // Formatters are immutable; one list per distinct hint is enough.
    private final Map<String, List<DateTimeFormatter>> dateFormats = new ConcurrentHashMap<>();

    public Coerced coerce(FieldRule rule, String raw) {
        return switch (rule.getValueType()) {
            case TEXT -> Coerced.ok(collapse(raw));
            case INTEGER -> toInteger(raw);
            case AMOUNT -> toAmount(rule.getFormatHint(), raw);
            case DATE -> toDate(rule.getFormatHint(), raw);
        };
    }

    static String collapse(String raw) {
        return raw.replaceAll("[\\s\\u00A0]+", " ").trim();
    }

    private Coerced toInteger(String raw) {
        String digits = raw.replaceAll("[\\s\\u00A0]", "");
        try {
            return Coerced.ok(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return Coerced.failed("not an integer: '" + raw.trim() + "'");
        }
    }

    private Coerced toAmount(String hint, String raw) {
        AmountFormat format = AmountFormat.fromHint(hint).orElse(AmountFormat.COMMA);
        Optional<BigDecimal> amount = format.parse(raw);
        return amount.map(Coerced::ok)
                .orElseGet(() -> Coerced.failed("not an amount: '" + raw.trim() + "'"));
    }

    private Coerced toDate(String hint, String raw) {
        String key = hint == null || hint.isBlank() ? DateFormats.DEFAULT_HINT : hint;
        String value = collapse(raw);
        for (DateTimeFormatter formatter : dateFormats.computeIfAbsent(key, DateFormats::fromHint)) {
            try {
                return Coerced.ok(LocalDate.parse(value, formatter));
            } catch (DateTimeParseException e) {
                // next layout
            }
        }
        return Coerced.failed("not a valid date: '" + value + "'");
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Coerced {
        Object value;
        String reason;

        public static Coerced ok(Object value) {
            return new Coerced(value, null);
        }

        public static Coerced failed(String reason) {
            return new Coerced(null, reason);
        }

        public boolean isOk() {
            return value != null;
        }
    }
}

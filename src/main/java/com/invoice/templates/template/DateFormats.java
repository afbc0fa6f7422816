package com.invoice.templates.template;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a date format hint ("dd.MM.yyyy|yyyy-MM-dd") into strict formatters.
 */
public final class DateFormats {

    public static final String DEFAULT_HINT = "dd.MM.yyyy|dd-MM-yyyy|yyyy-MM-dd|dd/MM/yyyy";

    private DateFormats() {
    }

    /**
     * @throws IllegalArgumentException if any layout is not a valid pattern
     */
    public static List<DateTimeFormatter> fromHint(String hint) {
        String effective = hint == null || hint.isBlank() ? DEFAULT_HINT : hint;
        return Arrays.stream(effective.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(DateFormats::strict)
                .toList();
    }

    // STRICT needs year-of-era paired with an era; "u" (proleptic year) avoids that.
    private static DateTimeFormatter strict(String layout) {
        return DateTimeFormatter.ofPattern(layout.replace('y', 'u'))
                .withResolverStyle(ResolverStyle.STRICT);
    }
}

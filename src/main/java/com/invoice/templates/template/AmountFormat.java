package com.invoice.templates.template;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decimal/thousands separator convention of an amount field.
 * COMMA reads "1 234,56" and "1.234,56"; POINT reads "1,234.56" and "1 234.56".
 */
public enum AmountFormat {

    COMMA(',', ' '),
    POINT('.', ',');

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern NOT_AMOUNT_CHAR = Pattern.compile("[^0-9.,'\\-]");
    private static final int MAX_SCALE = 2;

    private final char decimalSeparator;
    private final char groupingSeparator;

    AmountFormat(char decimalSeparator, char groupingSeparator) {
        this.decimalSeparator = decimalSeparator;
        this.groupingSeparator = groupingSeparator;
    }

    public static Optional<AmountFormat> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.of(COMMA);
        }
        return switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "comma", "decimal_comma" -> Optional.of(COMMA);
            case "point", "dot", "decimal_point" -> Optional.of(POINT);
            default -> Optional.empty();
        };
    }

    /**
     * Parses a captured amount. Currency symbols and whitespace are dropped;
     * values with more than two fractional digits are rejected.
     */
    public Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = NOT_AMOUNT_CHAR.matcher(raw).replaceAll("").replace("'", "");
        clean = this == COMMA
                ? clean.replace(".", "").replace(',', '.')
                : clean.replace(",", "");

        if (!PLAIN_DECIMAL.matcher(clean).matches()) {
            return Optional.empty();
        }
        BigDecimal value = new BigDecimal(clean);
        if (value.scale() > MAX_SCALE) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public String format(BigDecimal amount) {
        DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
        symbols.setDecimalSeparator(decimalSeparator);
        symbols.setGroupingSeparator(groupingSeparator);
        symbols.setMinusSign('-');
        DecimalFormat format = new DecimalFormat("#,##0.00", symbols);
        return format.format(amount);
    }
}

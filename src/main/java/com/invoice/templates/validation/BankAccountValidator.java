package com.invoice.templates.validation;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * IBAN check per ISO 13616: country length, then mod 97 over the rearranged
 * numeric form must equal 1.
 */
public final class BankAccountValidator {

    private static final Pattern IBAN_SHAPE = Pattern.compile("^[A-Z]{2}\\d{2}[A-Z0-9]+$");
    private static final Pattern DOMESTIC_PL = Pattern.compile("^\\d{26}$");
    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    private static final int MIN_LENGTH = 15;
    private static final int MAX_LENGTH = 34;

    private static final Map<String, Integer> COUNTRY_LENGTHS = Map.ofEntries(
            Map.entry("PL", 28), Map.entry("DE", 22), Map.entry("RO", 24), Map.entry("GB", 22),
            Map.entry("FR", 27), Map.entry("ES", 24), Map.entry("IT", 27), Map.entry("NL", 18),
            Map.entry("AT", 20), Map.entry("CZ", 24), Map.entry("SK", 24), Map.entry("BE", 16));

    private BankAccountValidator() {
    }

    public static ValidationOutcome validate(String raw) {
        if (raw == null || raw.isBlank()) {
            return ValidationOutcome.invalid(raw, "bank account is empty");
        }
        String iban = raw.replaceAll("[\\s-]", "").toUpperCase(Locale.ROOT);

        // 26 bare digits is a Polish domestic account number (NRB)
        if (DOMESTIC_PL.matcher(iban).matches()) {
            iban = "PL" + iban;
        }

        if (!IBAN_SHAPE.matcher(iban).matches()) {
            return ValidationOutcome.invalid(raw, "not an IBAN");
        }
        if (iban.length() < MIN_LENGTH || iban.length() > MAX_LENGTH) {
            return ValidationOutcome.invalid(raw, "IBAN length " + iban.length() + " out of range");
        }
        Integer expected = COUNTRY_LENGTHS.get(iban.substring(0, 2));
        if (expected != null && iban.length() != expected) {
            return ValidationOutcome.invalid(raw,
                    "IBAN for " + iban.substring(0, 2) + " must have " + expected + " characters");
        }

        String rearranged = iban.substring(4) + iban.substring(0, 4);
        StringBuilder numeric = new StringBuilder(rearranged.length() * 2);
        for (char c : rearranged.toCharArray()) {
            numeric.append(Character.isDigit(c) ? String.valueOf(c) : String.valueOf(c - 'A' + 10));
        }

        if (!new BigInteger(numeric.toString()).mod(NINETY_SEVEN).equals(BigInteger.ONE)) {
            return ValidationOutcome.invalid(raw, "IBAN checksum mismatch");
        }
        return ValidationOutcome.valid(group(iban));
    }

    /**
     * Printable form in blocks of four: "PL61 1090 1014 ...".
     */
    static String group(String iban) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < iban.length(); i += 4) {
            if (i > 0) out.append(' ');
            out.append(iban, i, Math.min(i + 4, iban.length()));
        }
        return out.toString();
    }
}

package com.invoice.templates.validation;

/**
 * Checksums of fiscal identifiers. Both routines are total: any input,
 * including null, yields an outcome.
 */
public final class FiscalIdValidator {

    private static final int[] NIP_WEIGHTS = {6, 5, 7, 2, 3, 4, 5, 6, 7};
    private static final int[] CUI_KEY = {7, 5, 3, 2, 1, 7, 5, 3, 2};

    private FiscalIdValidator() {
    }

    /**
     * Polish NIP: ten digits, weighted sum of the first nine mod 11 equals the
     * tenth. A remainder of 10 is never issued, so it never validates.
     */
    public static ValidationOutcome validateNip(String raw) {
        if (raw == null || raw.isBlank()) {
            return ValidationOutcome.invalid(raw, "fiscal id is empty");
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() != 10) {
            return ValidationOutcome.invalid(raw, "NIP must have 10 digits, found " + digits.length());
        }

        int sum = 0;
        for (int i = 0; i < NIP_WEIGHTS.length; i++) {
            sum += (digits.charAt(i) - '0') * NIP_WEIGHTS[i];
        }
        int check = sum % 11;

        if (check == 10 || check != digits.charAt(9) - '0') {
            return ValidationOutcome.invalid(raw, "NIP checksum mismatch");
        }
        return ValidationOutcome.valid(digits);
    }

    /**
     * Romanian CUI/CIF: 2 to 10 digits; the control key is right-aligned against
     * the digits preceding the check digit, control = (sum * 10) mod 11, 10 maps to 0.
     */
    public static ValidationOutcome validateCui(String raw) {
        if (raw == null || raw.isBlank()) {
            return ValidationOutcome.invalid(raw, "fiscal id is empty");
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() < 2 || digits.length() > 10) {
            return ValidationOutcome.invalid(raw, "CUI must have 2 to 10 digits, found " + digits.length());
        }

        int body = digits.length() - 1;
        int offset = CUI_KEY.length - body;
        int sum = 0;
        for (int i = 0; i < body; i++) {
            sum += (digits.charAt(i) - '0') * CUI_KEY[offset + i];
        }
        int control = sum * 10 % 11;
        if (control == 10) {
            control = 0;
        }

        if (control != digits.charAt(body) - '0') {
            return ValidationOutcome.invalid(raw, "CUI checksum mismatch");
        }
        return ValidationOutcome.valid(digits);
    }
}

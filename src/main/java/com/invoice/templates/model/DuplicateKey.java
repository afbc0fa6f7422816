package com.invoice.templates.model;

import com.invoice.templates.template.IssuerSignature;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Normalized fingerprint of a document: issuer fiscal id, document number,
 * document date and gross amount. Equal keys mark duplicate candidates,
 * whichever template produced them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DuplicateKey {

    private static final String SEPARATOR = "|";

    String fiscalId;
    String documentNumber;
    LocalDate documentDate;
    BigDecimal grossAmount;

    /** Components joined in fixed order. */
    String value;

    /** SHA-256 of {@link #value}, hex encoded. */
    String digest;

    public static DuplicateKey of(String fiscalId, String documentNumber, LocalDate documentDate, BigDecimal grossAmount) {
        String id = IssuerSignature.normalizeFiscalId(fiscalId);
        String number = documentNumber.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        BigDecimal amount = grossAmount.setScale(2, RoundingMode.HALF_UP);

        String value = String.join(SEPARATOR, id, number, documentDate.toString(), amount.toPlainString());
        return new DuplicateKey(id, number, documentDate, amount, value, sha256(value));
    }

    private static String sha256(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

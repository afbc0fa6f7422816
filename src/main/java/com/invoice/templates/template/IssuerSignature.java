package com.invoice.templates.template;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Evidence that attributes a document to one issuer. A template without a
 * signature is generic and only serves as a per-locale fallback.
 */
@Value
@Builder
public class IssuerSignature {

    public static final IssuerSignature NONE = IssuerSignature.builder().build();

    String name;

    @Singular
    List<String> keywords;

    /** As written in the template; compared in {@link #normalizeFiscalId} form. */
    String fiscalId;

    @Singular
    List<String> excludeKeywords;

    public boolean isEmpty() {
        return keywords.isEmpty() && !hasFiscalId();
    }

    public boolean hasFiscalId() {
        return fiscalId != null && !normalizedFiscalId().isEmpty();
    }

    public String normalizedFiscalId() {
        return fiscalId == null ? "" : normalizeFiscalId(fiscalId);
    }

    /**
     * Uppercase alphanumerics with a leading two-letter country prefix removed,
     * so "PL 526-025-09-95" and "5260250995" name the same issuer.
     */
    public static String normalizeFiscalId(String fiscalId) {
        String alnum = alphanumeric(fiscalId);
        return alnum.matches("[A-Z]{2}\\d+") ? alnum.substring(2) : alnum;
    }

    public static String alphanumeric(String value) {
        return value.replaceAll("[^\\p{Alnum}]", "").toUpperCase(Locale.ROOT);
    }
}

package com.invoice.templates.config;

import com.invoice.templates.loader.TemplateSource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings, bound from application.yml under the "extraction" prefix.
 *
 * Example:
 * extraction.templates[0].location=classpath:templates/pl
 * extraction.templates[0].locale=pl
 * extraction.matching.fiscal-id-weight=10000
 * extraction.validation.amount-ceiling=10000000.00
 */
@Data
@Component
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    /**
     * Template locations in load order. Later sources shadow earlier ones on id collision.
     */
    private List<TemplateSource> templates = new ArrayList<>();

    private Matching matching = new Matching();

    private Loading loading = new Loading();

    private Validation validation = new Validation();

    private Fingerprint fingerprint = new Fingerprint();

    private Invoice invoice = new Invoice();

    /**
     * Score weights. Whatever the values, a fiscal id hit must outweigh keyword
     * evidence and a single keyword must outweigh the whole priority range.
     */
    @Data
    public static class Matching {
        private long keywordWeight = 200;
        private long fiscalIdWeight = 10_000;
        private long priorityWeight = 1;

        /** Issuer-specific candidates scoring at or below this value are rejected; generic ones always qualify. */
        private long minScore = 0;
    }

    @Data
    public static class Loading {
        private int maxPatternLength = 500;
    }

    @Data
    public static class Validation {
        private int earliestYear = 1990;
        private int maxFutureYears = 2;
        private BigDecimal amountCeiling = new BigDecimal("10000000.00");
    }

    /**
     * Names of the extracted fields that make up a duplicate key.
     */
    @Data
    public static class Fingerprint {
        private String fiscalIdField = "supplier_tax_id";
        private String documentNumberField = "invoice_id";
        private String dateField = "issue_date";
        private String amountField = "total_gross";
    }

    /**
     * Field names and tolerances used by fallbacks and the invoice-level
     * consistency checks run after extraction.
     */
    @Data
    public static class Invoice {
        private String issueDateField = "issue_date";
        private String netField = "total_net";
        private String vatField = "total_vat";
        private String grossField = "total_gross";
        private String supplierTaxIdField = "supplier_tax_id";
        private String buyerTaxIdField = "buyer_tax_id";

        /** Line-item column summed against the gross amount. */
        private String lineTotalColumn = "gross";

        private BigDecimal totalsTolerance = new BigDecimal("0.02");
        private BigDecimal lineItemsTolerance = new BigDecimal("0.05");
    }
}

package com.invoice.templates.service;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.model.DuplicateKey;
import com.invoice.templates.model.ExtractionResult;
import com.invoice.templates.model.FingerprintOutcome;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the duplicate key of an extraction from four configured fields.
 */
@Component
public class DuplicateFingerprinter {

    private final ExtractionProperties.Fingerprint fields;

    public DuplicateFingerprinter(ExtractionProperties properties) {
        this.fields = properties.getFingerprint();
    }

    public FingerprintOutcome fingerprint(ExtractionResult result) {
        String fiscalId = result.getText(fields.getFiscalIdField());
        String number = result.getText(fields.getDocumentNumberField());
        LocalDate date = result.getDate(fields.getDateField());
        BigDecimal amount = result.getAmount(fields.getAmountField());

        List<String> missing = new ArrayList<>();
        if (isBlank(fiscalId)) missing.add(fields.getFiscalIdField());
        if (isBlank(number)) missing.add(fields.getDocumentNumberField());
        if (date == null) missing.add(fields.getDateField());
        if (amount == null) missing.add(fields.getAmountField());

        if (!missing.isEmpty()) {
            return FingerprintOutcome.incomplete(missing);
        }
        return FingerprintOutcome.of(DuplicateKey.of(fiscalId, number, date, amount));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

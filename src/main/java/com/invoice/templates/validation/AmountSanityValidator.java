package com.invoice.templates.validation;

import com.invoice.templates.config.ExtractionProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Guards against OCR digit insertion (absurd magnitudes) and against
 * non-positive document totals.
 */
@Component
public class AmountSanityValidator {

    private final BigDecimal ceiling;

    public AmountSanityValidator(ExtractionProperties properties) {
        this.ceiling = properties.getValidation().getAmountCeiling();
    }

    public ValidationOutcome validate(BigDecimal amount, boolean total) {
        if (amount == null) {
            return ValidationOutcome.invalid(null, "amount is empty");
        }
        if (total && amount.signum() <= 0) {
            return ValidationOutcome.invalid(amount.toPlainString(), "total must be positive");
        }
        if (amount.abs().compareTo(ceiling) > 0) {
            return ValidationOutcome.invalid(amount.toPlainString(), "amount exceeds " + ceiling.toPlainString());
        }
        return ValidationOutcome.valid(amount.toPlainString());
    }
}

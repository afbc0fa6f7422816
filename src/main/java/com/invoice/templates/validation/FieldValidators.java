package com.invoice.templates.validation;

import com.invoice.templates.template.FieldRule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Applies every check a field rule implies to an already coerced value: the
 * checksum validator named by the rule, plus date or amount sanity by type.
 */
@Component
public class FieldValidators {

    private final DateSanityValidator dateSanity;
    private final AmountSanityValidator amountSanity;

    public FieldValidators(DateSanityValidator dateSanity, AmountSanityValidator amountSanity) {
        this.dateSanity = dateSanity;
        this.amountSanity = amountSanity;
    }

    public ValidationOutcome validate(FieldRule rule, Object value) {
        if (value instanceof LocalDate date) {
            ValidationOutcome outcome = dateSanity.validate(date);
            if (!outcome.isValid()) return outcome;
        }
        if (value instanceof BigDecimal amount) {
            ValidationOutcome outcome = amountSanity.validate(amount, rule.isTotal());
            if (!outcome.isValid()) return outcome;
        }
        if (rule.getValidator() == null) {
            return ValidationOutcome.valid(String.valueOf(value));
        }

        String text = String.valueOf(value);
        return switch (rule.getValidator()) {
            case NIP -> FiscalIdValidator.validateNip(text);
            case CUI -> FiscalIdValidator.validateCui(text);
            case IBAN -> BankAccountValidator.validate(text);
        };
    }
}

package com.invoice.templates.validation;

import com.invoice.templates.config.ExtractionProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Rejects calendar-valid dates that are implausible for a business document.
 */
@Component
public class DateSanityValidator {

    private final int earliestYear;
    private final int maxFutureYears;
    private final Clock clock;

    public DateSanityValidator(ExtractionProperties properties, Clock clock) {
        this.earliestYear = properties.getValidation().getEarliestYear();
        this.maxFutureYears = properties.getValidation().getMaxFutureYears();
        this.clock = clock;
    }

    public ValidationOutcome validate(LocalDate date) {
        if (date == null) {
            return ValidationOutcome.invalid(null, "date is empty");
        }
        if (date.getYear() < earliestYear) {
            return ValidationOutcome.invalid(date.toString(), "date before " + earliestYear);
        }
        LocalDate latest = LocalDate.now(clock).plusYears(maxFutureYears);
        if (date.isAfter(latest)) {
            return ValidationOutcome.invalid(date.toString(), "date after " + latest);
        }
        return ValidationOutcome.valid(date.toString());
    }
}

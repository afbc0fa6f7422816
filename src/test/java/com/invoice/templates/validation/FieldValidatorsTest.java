package com.invoice.templates.validation;

import com.invoice.templates.TestFixtures;
import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.template.FieldRule;
import com.invoice.templates.template.FieldValidatorType;
import com.invoice.templates.template.ValueType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValidatorsTest {

    private final ExtractionProperties properties = TestFixtures.properties();
    private final DateSanityValidator dates = new DateSanityValidator(properties, TestFixtures.CLOCK);
    private final AmountSanityValidator amounts = new AmountSanityValidator(properties);
    private final FieldValidators validators = new FieldValidators(dates, amounts);

    @Test
    void datesMustBePlausible() {
        assertThat(dates.validate(LocalDate.of(1989, 12, 31)).getReason()).isEqualTo("date before 1990");
        assertThat(dates.validate(LocalDate.of(1990, 1, 1)).isValid()).isTrue();
        assertThat(dates.validate(LocalDate.of(2027, 6, 1)).isValid()).isTrue();
        assertThat(dates.validate(LocalDate.of(2027, 6, 2)).isValid()).isFalse();
    }

    @Test
    void totalsMustBePositiveAndBelowCeiling() {
        assertThat(amounts.validate(BigDecimal.ZERO, true).getReason()).isEqualTo("total must be positive");
        assertThat(amounts.validate(new BigDecimal("-5.00"), false).isValid()).isTrue();
        assertThat(amounts.validate(new BigDecimal("10000000.00"), true).isValid()).isTrue();
        assertThat(amounts.validate(new BigDecimal("10000000.01"), true).isValid()).isFalse();
        assertThat(amounts.validate(new BigDecimal("-10000000.01"), false).isValid()).isFalse();
    }

    @Test
    void appliesRuleValidatorAndNormalizes() {
        FieldRule nip = FieldRule.builder()
                .name("supplier_tax_id")
                .validator(FieldValidatorType.NIP)
                .build();

        ValidationOutcome outcome = validators.validate(nip, "526-025-09-95");

        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.getNormalized()).isEqualTo("5260250995");
    }

    @Test
    void appliesSanityByValueType() {
        FieldRule total = FieldRule.builder()
                .name("total_gross")
                .valueType(ValueType.AMOUNT)
                .total(true)
                .build();
        FieldRule issued = FieldRule.builder()
                .name("issue_date")
                .valueType(ValueType.DATE)
                .build();

        assertThat(validators.validate(total, new BigDecimal("-1.00")).isValid()).isFalse();
        assertThat(validators.validate(issued, LocalDate.of(1970, 1, 1)).isValid()).isFalse();
        assertThat(validators.validate(issued, LocalDate.of(2024, 3, 15)).isValid()).isTrue();
    }
}

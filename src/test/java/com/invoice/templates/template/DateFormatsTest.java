package com.invoice.templates.template;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateFormatsTest {

    @Test
    void defaultHintCoversCommonLayouts() {
        List<DateTimeFormatter> formats = DateFormats.fromHint(null);

        assertThat(formats).hasSize(4);
        assertThat(LocalDate.parse("15.03.2024", formats.get(0))).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(LocalDate.parse("2024-03-15", formats.get(2))).isEqualTo(LocalDate.of(2024, 3, 15));
    }

    @Test
    void resolvesStrictly() {
        DateTimeFormatter format = DateFormats.fromHint("dd.MM.yyyy").get(0);

        assertThatThrownBy(() -> LocalDate.parse("30.02.2024", format))
                .isInstanceOf(DateTimeParseException.class);
        assertThat(LocalDate.parse("29.02.2024", format)).isEqualTo(LocalDate.of(2024, 2, 29));
    }

    @Test
    void rejectsInvalidLayouts() {
        assertThatThrownBy(() -> DateFormats.fromHint("dd.MM.yyyy|{bad"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

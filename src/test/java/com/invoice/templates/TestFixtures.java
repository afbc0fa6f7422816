package com.invoice.templates;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.loader.PatternGuard;
import com.invoice.templates.loader.TemplateLoader;
import com.invoice.templates.loader.TemplateParser;
import com.invoice.templates.loader.TemplateSource;
import com.invoice.templates.service.ConsistencyChecker;
import com.invoice.templates.service.TableExtractor;
import com.invoice.templates.service.TemplateExtractionEngine;
import com.invoice.templates.service.ValueCoercer;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.TemplateStore;
import com.invoice.templates.validation.AmountSanityValidator;
import com.invoice.templates.validation.DateSanityValidator;
import com.invoice.templates.validation.FieldValidators;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Shared wiring for plain unit tests.
 */
public final class TestFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

    private TestFixtures() {
    }

    public static ExtractionProperties properties() {
        return new ExtractionProperties();
    }

    public static DocumentTemplate template(String id, String yaml) {
        return new TemplateParser(new PatternGuard(500)).parse(id, yaml, null, "test:" + id);
    }

    public static TemplateStore store(DocumentTemplate... templates) {
        return new TemplateStore(1, CLOCK.instant(), Arrays.asList(templates), List.of());
    }

    /**
     * The templates shipped with the application.
     */
    public static TemplateStore shippedStore() {
        ExtractionProperties properties = properties();
        properties.setTemplates(List.of(
                new TemplateSource("classpath:templates/pl", "pl"),
                new TemplateSource("classpath:templates/de", "de"),
                new TemplateSource("classpath:templates/ro", "ro")));
        return new TemplateLoader(properties, CLOCK).load(properties.getTemplates());
    }

    public static TemplateExtractionEngine engine() {
        ExtractionProperties properties = properties();
        FieldValidators validators = new FieldValidators(
                new DateSanityValidator(properties, CLOCK),
                new AmountSanityValidator(properties));
        return new TemplateExtractionEngine(new ValueCoercer(), validators, new TableExtractor(),
                new ConsistencyChecker(properties), properties);
    }

    public static String document(String name) {
        try (InputStream in = TestFixtures.class.getResourceAsStream("/documents/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No test document " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

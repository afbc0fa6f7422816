package com.invoice.templates.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.invoice.templates.exception.TemplateValidationException;
import com.invoice.templates.template.AmountFormat;
import com.invoice.templates.template.ColumnRule;
import com.invoice.templates.template.DateFormats;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.FieldFallback;
import com.invoice.templates.template.FieldRule;
import com.invoice.templates.template.FieldValidatorType;
import com.invoice.templates.template.IssuerSignature;
import com.invoice.templates.template.TableRule;
import com.invoice.templates.template.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns one YAML template document into a {@link DocumentTemplate}. Every
 * structural problem surfaces as a {@link TemplateValidationException} whose
 * message becomes the load error reason.
 */
public class TemplateParser {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    private final PatternGuard patternGuard;

    public TemplateParser(PatternGuard patternGuard) {
        this.patternGuard = patternGuard;
    }

    /**
     * @param derivedId     id used when the document does not name itself
     * @param content       YAML text
     * @param defaultLocale locale of the source location, may be null
     * @param source        where the content came from
     */
    public DocumentTemplate parse(String derivedId, String content, String defaultLocale, String source) {
        TemplateDocument doc = read(content);

        if (doc.getFields() == null || doc.getFields().isEmpty()) {
            throw new TemplateValidationException("template declares no fields");
        }

        TemplateDocument.Header header = doc.getTemplate() != null
                ? doc.getTemplate()
                : new TemplateDocument.Header();

        String id = isBlank(header.getName()) ? derivedId : header.getName().trim();
        String locale = normalizeLocale(isBlank(header.getLocale()) ? defaultLocale : header.getLocale());
        int priority = header.getPriority() == null
                ? DocumentTemplate.DEFAULT_PRIORITY
                : Math.max(DocumentTemplate.MIN_PRIORITY,
                        Math.min(DocumentTemplate.MAX_PRIORITY, header.getPriority()));

        Map<String, FieldRule> fields = new LinkedHashMap<>();
        doc.getFields().forEach((name, field) -> fields.put(name, parseField(name, field)));

        Map<String, TableRule> tables = new LinkedHashMap<>();
        if (doc.getTables() != null) {
            doc.getTables().forEach((name, table) -> tables.put(name, parseTable(name, table)));
        }

        return DocumentTemplate.builder()
                .id(id)
                .locale(locale)
                .priority(priority)
                .issuer(parseIssuer(doc.getIssuer()))
                .fields(Collections.unmodifiableMap(fields))
                .tables(Collections.unmodifiableMap(tables))
                .source(source)
                .build();
    }

    public static String normalizeLocale(String locale) {
        return isBlank(locale) ? null : locale.trim().toLowerCase(Locale.ROOT);
    }

    // ─── SECTIONS ──────────────────────────────────────────────────────────

    private TemplateDocument read(String content) {
        try {
            TemplateDocument doc = YAML.readValue(content, TemplateDocument.class);
            if (doc == null) {
                throw new TemplateValidationException("empty template document");
            }
            return doc;
        } catch (JsonProcessingException e) {
            throw new TemplateValidationException("unreadable template document: " + e.getOriginalMessage(), e);
        }
    }

    private IssuerSignature parseIssuer(TemplateDocument.Issuer issuer) {
        if (issuer == null) {
            return IssuerSignature.NONE;
        }
        return IssuerSignature.builder()
                .name(issuer.getName())
                .keywords(nonBlank(issuer.getKeywords()))
                .fiscalId(isBlank(issuer.getFiscalId()) ? null : issuer.getFiscalId().trim())
                .excludeKeywords(nonBlank(issuer.getExcludeKeywords()))
                .build();
    }

    private FieldRule parseField(String name, TemplateDocument.Field field) {
        if (field == null) {
            throw new TemplateValidationException("field '" + name + "' has no definition");
        }
        List<String> patterns = nonBlank(field.getPatterns());
        if (patterns.isEmpty()) {
            throw new TemplateValidationException("field '" + name + "' has no patterns");
        }

        ValueType type = ValueType.fromKey(field.getType())
                .orElseThrow(() -> new TemplateValidationException(
                        "field '" + name + "' has unknown type '" + field.getType() + "'"));

        FieldValidatorType validator = null;
        if (!isBlank(field.getValidator())) {
            validator = FieldValidatorType.fromKey(field.getValidator())
                    .orElseThrow(() -> new TemplateValidationException(
                            "field '" + name + "' has unknown validator '" + field.getValidator() + "'"));
        }

        checkFormat(name, type, field.getFormat());

        int group = field.getGroup() == null ? 1 : field.getGroup();
        if (group < 0) {
            throw new TemplateValidationException("field '" + name + "' has a negative group");
        }

        int contextRange = field.getContextRange() == null ? FieldRule.DEFAULT_CONTEXT_RANGE : field.getContextRange();
        if (contextRange <= 0) {
            throw new TemplateValidationException("field '" + name + "' needs a positive context_range");
        }

        FieldRule.FieldRuleBuilder rule = FieldRule.builder()
                .name(name)
                .group(group)
                .required(field.isRequired())
                .valueType(type)
                .formatHint(field.getFormat())
                .validator(validator)
                .total(field.isTotal())
                .fallback(parseFallback(name, type, field.getFallback()))
                .contextKeywords(nonBlank(field.getContextKeywords()))
                .contextRange(contextRange);
        for (String pattern : patterns) {
            Pattern compiled = compile("field '" + name + "'", pattern);
            checkGroup(name, group, compiled);
            rule.pattern(compiled);
        }
        return rule.build();
    }

    private static FieldFallback parseFallback(String name, ValueType type, String expression) {
        if (isBlank(expression)) {
            return null;
        }
        FieldFallback fallback = FieldFallback.fromKey(expression)
                .orElseThrow(() -> new TemplateValidationException(
                        "field '" + name + "' has unknown fallback '" + expression + "'"));
        if (fallback.getKind().produces() != type) {
            throw new TemplateValidationException(String.format("field '%s' of type %s cannot use fallback '%s'",
                    name, type.name().toLowerCase(Locale.ROOT), expression));
        }
        return fallback;
    }

    // a pattern without groups yields its whole match for group 0 or 1
    private static void checkGroup(String name, int group, Pattern pattern) {
        int groups = pattern.matcher("").groupCount();
        if (group > Math.max(groups, 1)) {
            throw new TemplateValidationException(String.format(
                    "field '%s' uses group %d but pattern '%s' has %d", name, group, pattern.pattern(), groups));
        }
    }

    private void checkFormat(String name, ValueType type, String format) {
        if (type == ValueType.AMOUNT && AmountFormat.fromHint(format).isEmpty()) {
            throw new TemplateValidationException(
                    "field '" + name + "' has unknown amount format '" + format + "'");
        }
        if (type == ValueType.DATE) {
            try {
                DateFormats.fromHint(format);
            } catch (IllegalArgumentException e) {
                throw new TemplateValidationException(
                        "field '" + name + "' has invalid date format '" + format + "'", e);
            }
        }
    }

    private TableRule parseTable(String name, TemplateDocument.Table table) {
        if (table == null || isBlank(table.getStart()) || isBlank(table.getEnd())) {
            throw new TemplateValidationException("table '" + name + "' needs start and end patterns");
        }
        if (table.getColumns() == null || table.getColumns().isEmpty()) {
            throw new TemplateValidationException("table '" + name + "' declares no columns");
        }

        TableRule.TableRuleBuilder rule = TableRule.builder()
                .name(name)
                .start(compile("table '" + name + "' start", table.getStart()))
                .end(compile("table '" + name + "' end", table.getEnd()));

        for (TemplateDocument.Column column : table.getColumns()) {
            if (column == null || isBlank(column.getName()) || isBlank(column.getPattern())) {
                throw new TemplateValidationException("table '" + name + "' has a column without name or pattern");
            }
            rule.column(new ColumnRule(column.getName(),
                    compile("column '" + column.getName() + "'", column.getPattern())));
        }
        for (String skip : nonBlank(table.getSkip())) {
            rule.skipPattern(compile("table '" + name + "' skip", skip));
        }
        return rule.build();
    }

    private Pattern compile(String owner, String regex) {
        try {
            return patternGuard.compile(regex);
        } catch (TemplateValidationException e) {
            throw new TemplateValidationException(owner + ": " + e.getMessage(), e);
        }
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .filter(v -> !v.isBlank())
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.invoice.templates.service;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.exception.EmptyDocumentException;
import com.invoice.templates.model.ExtractionResult;
import com.invoice.templates.model.FieldIssue;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.FieldFallback;
import com.invoice.templates.template.FieldRule;
import com.invoice.templates.template.TableRule;
import com.invoice.templates.validation.FieldValidators;
import com.invoice.templates.validation.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
public class TemplateExtractionEngine {

    // characters kept before a context keyword
    private static final int CONTEXT_LEAD = 50;

    private final ValueCoercer coercer;
    private final FieldValidators validators;
    private final TableExtractor tableExtractor;
    private final ConsistencyChecker consistencyChecker;
    private final ExtractionProperties.Invoice invoice;

    public TemplateExtractionEngine(ValueCoercer coercer, FieldValidators validators, TableExtractor tableExtractor,
                                    ConsistencyChecker consistencyChecker, ExtractionProperties properties) {
        this.coercer = coercer;
        this.validators = validators;
        this.tableExtractor = tableExtractor;
        this.consistencyChecker = consistencyChecker;
        this.invoice = properties.getInvoice();
    }

    /**
     * Applies every field and table rule of the template to the text, then the
     * fallbacks of unmatched fields and the cross-field checks. Problems with
     * single fields are recorded on the result; only blank text fails.
     */
    public ExtractionResult extract(String text, DocumentTemplate template) {
        if (text == null || text.isBlank()) {
            throw new EmptyDocumentException();
        }

        ExtractionResult result = new ExtractionResult();
        result.setTemplateId(template.getId());
        result.setTemplateName(template.displayName());

        String normalized = text.replaceAll("\\s+", " ").trim();

        List<FieldRule> unmatched = new ArrayList<>();
        for (FieldRule rule : template.getFields().values()) {
            if (!extractField(text, normalized, rule, result)) {
                unmatched.add(rule);
            }
        }

        // fallbacks read other fields, so they run once every pattern has been tried
        for (FieldRule rule : unmatched) {
            applyFallback(rule, result);
        }

        for (TableRule table : template.getTables().values()) {
            result.getTables().put(table.getName(), tableExtractor.extract(text, table));
        }

        consistencyChecker.check(result, template);
        result.calculateCoverage(template.getFields().size());
        log.info("Extracted {}/{} fields with template '{}' (status: {})",
                result.getFields().size(), template.getFields().size(), template.getId(), result.getStatus());
        return result;
    }

    // ─── FIELDS ────────────────────────────────────────────────────────────

    /**
     * @return false when no pattern matched and the field awaits its fallback
     */
    private boolean extractField(String original, String normalized, FieldRule rule, ExtractionResult result) {
        String raw = rule.getContextKeywords().isEmpty()
                ? tryExtract(original, normalized, rule)
                : tryExtractInContext(original, rule);
        if (raw == null) {
            if (rule.getFallback() != null) {
                return false;
            }
            missing(rule, result);
            return true;
        }

        ValueCoercer.Coerced coerced = coercer.coerce(rule, raw);
        if (!coerced.isOk()) {
            invalid(rule, coerced.getReason(), result);
            return true;
        }
        accept(rule, coerced.getValue(), result);
        return true;
    }

    private boolean accept(FieldRule rule, Object coerced, ExtractionResult result) {
        ValidationOutcome outcome = validators.validate(rule, coerced);
        if (!outcome.isValid()) {
            invalid(rule, outcome.getReason(), result);
            return false;
        }

        Object value = rule.getValidator() != null ? outcome.getNormalized() : coerced;
        result.getFields().put(rule.getName(), value);
        log.debug("Field '{}' = {}", rule.getName(), value);
        return true;
    }

    private String tryExtractInContext(String original, FieldRule rule) {
        String context = contextOf(original, rule);
        return tryExtract(context, context.replaceAll("\\s+", " ").trim(), rule);
    }

    /**
     * Text around the first occurrence of each context keyword, from a few
     * characters before it to contextRange characters after it. The whole text
     * when no keyword occurs.
     */
    private static String contextOf(String text, FieldRule rule) {
        List<String> windows = new ArrayList<>();
        for (String keyword : rule.getContextKeywords()) {
            Matcher m = Pattern.compile(Pattern.quote(keyword), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(text);
            if (m.find()) {
                int start = Math.max(0, m.start() - CONTEXT_LEAD);
                int end = Math.min(text.length(), m.start() + rule.getContextRange());
                windows.add(text.substring(start, end));
            }
        }
        return windows.isEmpty() ? text : String.join(" ", windows);
    }

    /**
     * Tries each pattern in order, against the original text and then against
     * the whitespace-normalized text. The first non-blank capture wins.
     */
    private String tryExtract(String original, String normalized, FieldRule rule) {
        for (Pattern pattern : rule.getPatterns()) {
            for (String candidate : List.of(original, normalized)) {
                Matcher m = pattern.matcher(candidate);
                if (m.find()) {
                    String value = capture(m, rule.getGroup());
                    if (value != null && !value.isBlank()) {
                        return value.trim();
                    }
                }
            }
        }
        return null;
    }

    private static String capture(Matcher m, int group) {
        if (m.groupCount() == 0) {
            return m.group();
        }
        return group <= m.groupCount() ? m.group(group) : null;
    }

    // ─── FALLBACKS ─────────────────────────────────────────────────────────

    private void applyFallback(FieldRule rule, ExtractionResult result) {
        Object value = derive(rule.getFallback(), result);
        if (value == null) {
            log.debug("Fallback of field '{}' has no inputs", rule.getName());
            missing(rule, result);
            return;
        }
        if (accept(rule, value, result)) {
            result.getDerivedFields().add(rule.getName());
        }
    }

    private Object derive(FieldFallback fallback, ExtractionResult result) {
        LocalDate issued = result.getDate(invoice.getIssueDateField());
        BigDecimal gross = result.getAmount(invoice.getGrossField());
        BigDecimal net = result.getAmount(invoice.getNetField());

        return switch (fallback.getKind()) {
            case USE_ISSUE_DATE -> issued;
            case ADD_DAYS -> issued == null ? null : issued.plusDays(fallback.getDays());
            case CALCULATE_FROM_GROSS -> gross == null ? null
                    : gross.divide(BigDecimal.ONE.add(fallback.getRate().movePointLeft(2)), 2, RoundingMode.HALF_UP);
            case CALCULATE_DIFFERENCE -> gross == null || net == null ? null : gross.subtract(net);
        };
    }

    private void missing(FieldRule rule, ExtractionResult result) {
        if (rule.isRequired()) {
            log.debug("Required field '{}' not found", rule.getName());
            result.markIncomplete(FieldIssue.missing(rule.getName()));
        }
    }

    private void invalid(FieldRule rule, String reason, ExtractionResult result) {
        log.warn("Field '{}' rejected: {}", rule.getName(), reason);
        if (rule.isRequired()) {
            result.markIncomplete(FieldIssue.invalid(rule.getName(), reason));
        } else {
            result.getIssues().add(FieldIssue.invalid(rule.getName(), reason));
        }
    }
}

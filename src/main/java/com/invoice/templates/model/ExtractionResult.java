package com.invoice.templates.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured output of one extraction. Field values are typed by the rule:
 * String (text, validated ids), LocalDate, BigDecimal or Long. Absent fields
 * are simply not in the map.
 */
@Data
public class ExtractionResult {

    private String templateId;
    private String templateName;
    private Map<String, Object> fields = new LinkedHashMap<>();
    private Map<String, List<ExtractedRow>> tables = new LinkedHashMap<>();
    private List<FieldIssue> issues = new ArrayList<>();

    /** Fields filled by a fallback rule rather than a pattern. */
    private List<String> derivedFields = new ArrayList<>();
    private boolean complete = true;
    private double coverage;
    private ExtractionStatus status = ExtractionStatus.COMPLETE;

    public Object get(String field) {
        return fields.get(field);
    }

    public String getText(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public LocalDate getDate(String field) {
        return fields.get(field) instanceof LocalDate date ? date : null;
    }

    public BigDecimal getAmount(String field) {
        Object value = fields.get(field);
        if (value instanceof BigDecimal amount) return amount;
        if (value instanceof Long number) return BigDecimal.valueOf(number);
        return null;
    }

    /**
     * Rows of every table, in table declaration order.
     */
    @JsonIgnore
    public List<ExtractedRow> getLineItems() {
        List<ExtractedRow> rows = new ArrayList<>();
        tables.values().forEach(rows::addAll);
        return rows;
    }

    public void markIncomplete(FieldIssue issue) {
        issues.add(issue);
        complete = false;
        status = ExtractionStatus.PARTIAL;
    }

    /**
     * Share of the template's declared fields that made it into the result.
     */
    public void calculateCoverage(int declaredFields) {
        this.coverage = declaredFields == 0 ? 0.0 : (fields.size() * 100.0) / declaredFields;
    }
}

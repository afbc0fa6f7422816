package com.invoice.templates.service;

import com.invoice.templates.model.ExtractedRow;
import com.invoice.templates.template.ColumnRule;
import com.invoice.templates.template.TableRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads line items. Only lines where every column pattern matches, each one
 * after the previous, become rows; the rest of the region is noise.
 */
@Component
@Slf4j
public class TableExtractor {

    public List<ExtractedRow> extract(String text, TableRule table) {
        String region = region(text, table);
        if (region == null) {
            log.debug("Table '{}': start marker not found", table.getName());
            return List.of();
        }

        List<ExtractedRow> rows = new ArrayList<>();
        for (String line : region.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || isSkipped(trimmed, table)) continue;

            ExtractedRow row = readRow(trimmed, table.getColumns());
            if (row != null) {
                rows.add(row);
            }
        }
        log.debug("Table '{}': {} rows", table.getName(), rows.size());
        return rows;
    }

    // ─── REGION ────────────────────────────────────────────────────────────

    /**
     * Text after the first start match up to the next end match, or to the
     * end of the document when no end marker follows.
     */
    private String region(String text, TableRule table) {
        Matcher start = table.getStart().matcher(text);
        if (!start.find()) {
            return null;
        }
        Matcher end = table.getEnd().matcher(text);
        int to = end.find(start.end()) ? end.start() : text.length();
        return text.substring(start.end(), to);
    }

    private boolean isSkipped(String line, TableRule table) {
        for (Pattern skip : table.getSkipPatterns()) {
            if (skip.matcher(line).find()) return true;
        }
        return false;
    }

    // ─── ROW ───────────────────────────────────────────────────────────────

    private ExtractedRow readRow(String line, List<ColumnRule> columns) {
        ExtractedRow row = new ExtractedRow();
        int position = 0;

        for (ColumnRule column : columns) {
            Matcher m = column.getPattern().matcher(line);
            m.region(position, line.length());
            if (!m.find()) {
                return null;
            }
            String value = m.groupCount() > 0 ? m.group(1) : m.group();
            if (value == null || value.isBlank()) {
                return null;
            }
            row.put(column.getName(), ValueCoercer.collapse(value));
            position = m.end();
        }
        return row;
    }
}

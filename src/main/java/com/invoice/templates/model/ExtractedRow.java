package com.invoice.templates.model;

import java.util.LinkedHashMap;

/**
 * One line-item row. Keys are the column names of the table rule, in column
 * order; values are the trimmed captures.
 */
public class ExtractedRow extends LinkedHashMap<String, String> {

    public String getString(String column) {
        return get(column);
    }

    public boolean hasAll(Iterable<String> columns) {
        for (String column : columns) {
            if (!containsKey(column)) {
                return false;
            }
        }
        return true;
    }
}

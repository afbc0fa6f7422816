package com.invoice.templates.template;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-item table: the region between {@code start} and {@code end} is split
 * into lines, and every line is tokenized by the column patterns in sequence.
 */
@Value
@Builder
public class TableRule {

    @NonNull
    String name;

    @NonNull
    Pattern start;

    @NonNull
    Pattern end;

    @Singular
    List<ColumnRule> columns;

    @Singular
    List<Pattern> skipPatterns;
}

package com.invoice.templates.template;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Extraction rule for one named field. Patterns are compiled once at load time
 * and tried in declaration order; the first one yielding a capture wins.
 */
@Value
@Builder
public class FieldRule {

    public static final int DEFAULT_CONTEXT_RANGE = 200;

    @NonNull
    String name;

    @Singular
    List<Pattern> patterns;

    /** Capture group to read; group 0 is used when the pattern has no groups. */
    @Builder.Default
    int group = 1;

    boolean required;

    @NonNull
    @Builder.Default
    ValueType valueType = ValueType.TEXT;

    /** Date layouts separated by '|', or the amount separator convention. */
    String formatHint;

    /** Nullable. */
    FieldValidatorType validator;

    /** Marks an amount as a document total (must be positive). */
    boolean total;

    /** Nullable; applied only when no pattern matches. */
    FieldFallback fallback;

    /** When set, patterns search only the text around these keywords. */
    @Singular
    List<String> contextKeywords;

    /** Characters kept after each context keyword. */
    @Builder.Default
    int contextRange = DEFAULT_CONTEXT_RANGE;
}

package com.invoice.templates.template;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * Immutable rule set for one class of document. Field and table maps keep
 * declaration order.
 */
@Value
@Builder(toBuilder = true)
public class DocumentTemplate {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;
    public static final int DEFAULT_PRIORITY = 50;

    @NonNull
    String id;

    /** Lower-case tag such as "pl"; null when the template applies to any locale. */
    String locale;

    int priority;

    @NonNull
    @Builder.Default
    IssuerSignature issuer = IssuerSignature.NONE;

    @NonNull
    Map<String, FieldRule> fields;

    @NonNull
    @Builder.Default
    Map<String, TableRule> tables = Map.of();

    /** Resource the template was read from, for diagnostics. */
    String source;

    public boolean isGeneric() {
        return issuer.isEmpty();
    }

    public String displayName() {
        return issuer.getName() != null ? issuer.getName() : id;
    }
}

package com.invoice.templates.model;

import lombok.Value;

@Value
public class FieldIssue {

    /** INCONSISTENT issues come from cross-field checks and never affect completeness. */
    public enum Kind { MISSING, INVALID, INCONSISTENT }

    String field;
    Kind kind;
    String reason;

    public static FieldIssue missing(String field) {
        return new FieldIssue(field, Kind.MISSING, "no pattern matched");
    }

    public static FieldIssue invalid(String field, String reason) {
        return new FieldIssue(field, Kind.INVALID, reason);
    }

    public static FieldIssue inconsistent(String field, String reason) {
        return new FieldIssue(field, Kind.INCONSISTENT, reason);
    }
}

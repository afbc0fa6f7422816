package com.invoice.templates.model;

import lombok.Value;

import java.time.Instant;

@Value
public class DuplicateCheck {

    boolean duplicate;

    /** Source reference of the first document seen with the same key. */
    String firstSourceRef;

    Instant firstSeenAt;
}

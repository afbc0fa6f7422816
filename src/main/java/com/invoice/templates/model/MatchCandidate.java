package com.invoice.templates.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.invoice.templates.template.DocumentTemplate;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Score card of one template against one document.
 */
@Value
@Builder
public class MatchCandidate {

    String templateId;
    long score;
    int priority;

    @Singular
    List<String> matchedKeywords;

    boolean matchedFiscalId;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    DocumentTemplate template;
}

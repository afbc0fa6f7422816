package com.invoice.templates.model;

import com.invoice.templates.template.DocumentTemplate;
import lombok.Value;

import java.util.List;

@Value
public class TemplateSummary {

    String id;
    String name;
    String locale;
    int priority;
    boolean generic;
    List<String> fields;
    String source;

    public static TemplateSummary of(DocumentTemplate template) {
        return new TemplateSummary(
                template.getId(),
                template.displayName(),
                template.getLocale(),
                template.getPriority(),
                template.isGeneric(),
                List.copyOf(template.getFields().keySet()),
                template.getSource());
    }
}

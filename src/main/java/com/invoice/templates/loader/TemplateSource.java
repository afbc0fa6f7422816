package com.invoice.templates.loader;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A location holding template documents, e.g. {@code classpath:templates/pl}
 * or {@code file:/etc/invoice-templates/custom}. The locale applies to every
 * document below it that does not declare its own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateSource {
    private String location;
    private String locale;
}

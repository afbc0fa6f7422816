package com.invoice.templates.template;

import lombok.NonNull;
import lombok.Value;

import java.util.regex.Pattern;

@Value
public class ColumnRule {
    @NonNull
    String name;
    @NonNull
    Pattern pattern;
}

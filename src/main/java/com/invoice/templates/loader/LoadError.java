package com.invoice.templates.loader;

import lombok.Value;

@Value
public class LoadError {
    String path;
    String reason;
}

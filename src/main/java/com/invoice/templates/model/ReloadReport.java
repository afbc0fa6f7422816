package com.invoice.templates.model;

import com.invoice.templates.loader.LoadError;
import com.invoice.templates.template.TemplateStore;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ReloadReport {

    long version;
    int templateCount;
    Instant loadedAt;
    List<LoadError> errors;

    public static ReloadReport of(TemplateStore store) {
        return new ReloadReport(store.getVersion(), store.size(), store.getLoadedAt(), store.getLoadErrors());
    }
}

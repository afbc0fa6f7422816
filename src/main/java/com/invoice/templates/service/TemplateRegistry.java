package com.invoice.templates.service;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.exception.StoreEmptyException;
import com.invoice.templates.loader.TemplateLoader;
import com.invoice.templates.template.TemplateStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active template store. Readers take a snapshot with
 * {@link #current()}; a reload swaps in a complete new store or nothing.
 */
@Service
@Slf4j
public class TemplateRegistry {

    private final TemplateLoader loader;
    private final ExtractionProperties properties;
    private final AtomicReference<TemplateStore> active = new AtomicReference<>();

    public TemplateRegistry(TemplateLoader loader, ExtractionProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    public TemplateStore current() {
        TemplateStore store = active.get();
        if (store == null) {
            throw new StoreEmptyException("Template store has not been loaded", List.of());
        }
        return store;
    }

    /**
     * Loads all configured sources into a new store. On failure the previous
     * store stays active and the exception propagates.
     */
    public synchronized TemplateStore reload() {
        TemplateStore fresh;
        try {
            fresh = loader.load(properties.getTemplates());
        } catch (StoreEmptyException e) {
            log.warn("Reload failed, keeping store version {}: {}", versionOf(active.get()), e.getMessage());
            throw e;
        }
        TemplateStore previous = active.getAndSet(fresh);
        log.info("Template store version {} active ({} templates, replaced version {})",
                fresh.getVersion(), fresh.size(), versionOf(previous));
        return fresh;
    }

    private static String versionOf(TemplateStore store) {
        return store == null ? "none" : String.valueOf(store.getVersion());
    }
}

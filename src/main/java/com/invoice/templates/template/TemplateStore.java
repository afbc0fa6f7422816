package com.invoice.templates.template;

import com.invoice.templates.loader.LoadError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every usable template, indexed by id and by locale.
 * A reload builds a new store; an existing one never changes.
 */
public final class TemplateStore {

    private static final Comparator<DocumentTemplate> BY_PRIORITY =
            Comparator.comparingInt(DocumentTemplate::getPriority).reversed()
                    .thenComparing(DocumentTemplate::getId);

    private final long version;
    private final Instant loadedAt;
    private final Map<String, DocumentTemplate> byId;
    private final Map<String, List<DocumentTemplate>> byLocale;
    private final List<DocumentTemplate> unrestricted;
    private final List<LoadError> loadErrors;

    public TemplateStore(long version, Instant loadedAt,
                         Collection<DocumentTemplate> templates, List<LoadError> loadErrors) {
        this.version = version;
        this.loadedAt = loadedAt;

        Map<String, DocumentTemplate> ids = new LinkedHashMap<>();
        Map<String, List<DocumentTemplate>> locales = new LinkedHashMap<>();
        List<DocumentTemplate> anyLocale = new ArrayList<>();

        templates.stream().sorted(BY_PRIORITY).forEach(t -> {
            ids.put(t.getId(), t);
            if (t.getLocale() == null) {
                anyLocale.add(t);
            } else {
                locales.computeIfAbsent(t.getLocale(), k -> new ArrayList<>()).add(t);
            }
        });

        this.byId = Collections.unmodifiableMap(ids);
        this.byLocale = freeze(locales);
        this.unrestricted = List.copyOf(anyLocale);
        this.loadErrors = List.copyOf(loadErrors);
    }

    /**
     * Templates for the locale plus the locale-free ones, highest priority first.
     * A null hint returns every template.
     */
    public List<DocumentTemplate> candidatesFor(String localeHint) {
        if (localeHint == null) {
            return all();
        }
        List<DocumentTemplate> candidates = new ArrayList<>(byLocale.getOrDefault(localeHint, List.of()));
        candidates.addAll(unrestricted);
        candidates.sort(BY_PRIORITY);
        return candidates;
    }

    public List<DocumentTemplate> all() {
        return List.copyOf(byId.values());
    }

    public Optional<DocumentTemplate> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<String> locales() {
        return List.copyOf(byLocale.keySet());
    }

    public int size() {
        return byId.size();
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public List<LoadError> getLoadErrors() {
        return loadErrors;
    }

    private static Map<String, List<DocumentTemplate>> freeze(Map<String, List<DocumentTemplate>> source) {
        Map<String, List<DocumentTemplate>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}

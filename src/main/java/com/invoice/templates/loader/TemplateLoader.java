package com.invoice.templates.loader;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.exception.StoreEmptyException;
import com.invoice.templates.exception.TemplateValidationException;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.TemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a fresh {@link TemplateStore} from an ordered list of template
 * sources. A broken document is recorded as a {@link LoadError} and skipped;
 * only a load that ends with no usable template fails.
 */
@Component
@Slf4j
public class TemplateLoader {

    private static final List<String> EXTENSIONS = List.of("yml", "yaml");

    private final ResourcePatternResolver resolver;
    private final TemplateParser parser;
    private final Clock clock;
    private final AtomicLong versions = new AtomicLong();

    public TemplateLoader(ExtractionProperties properties, Clock clock) {
        this.resolver = new PathMatchingResourcePatternResolver();
        this.parser = new TemplateParser(new PatternGuard(properties.getLoading().getMaxPatternLength()));
        this.clock = clock;
    }

    public TemplateStore load(List<TemplateSource> sources) {
        Map<String, DocumentTemplate> templates = new LinkedHashMap<>();
        List<LoadError> errors = new ArrayList<>();

        for (TemplateSource source : sources) {
            String defaultLocale = TemplateParser.normalizeLocale(source.getLocale());

            for (Map.Entry<String, Resource> entry : findDocuments(source, errors).entrySet()) {
                String path = entry.getKey();
                try {
                    DocumentTemplate template = parser.parse(
                            deriveId(source.getLocation(), path), read(entry.getValue()), defaultLocale, path);

                    DocumentTemplate shadowed = templates.put(template.getId(), template);
                    if (shadowed != null) {
                        log.info("Template '{}' from {} overrides {}", template.getId(), path, shadowed.getSource());
                    }
                    log.debug("Loaded template '{}' (locale: {}, priority: {}, fields: {})",
                            template.getId(), template.getLocale(), template.getPriority(), template.getFields().size());

                } catch (TemplateValidationException | IOException e) {
                    log.warn("Skipping template {}: {}", path, e.getMessage());
                    errors.add(new LoadError(path, e.getMessage()));
                }
            }
        }

        if (templates.isEmpty()) {
            throw new StoreEmptyException(
                    "No usable templates in " + sources.size() + " source(s), " + errors.size() + " error(s)", errors);
        }

        TemplateStore store = new TemplateStore(versions.incrementAndGet(), clock.instant(), templates.values(), errors);
        log.info("Loaded {} templates (store version {}, {} errors)", store.size(), store.getVersion(), errors.size());
        return store;
    }

    // ─── DISCOVERY ─────────────────────────────────────────────────────────

    /**
     * All template documents below the source location, keyed and ordered by path
     * so that loads are reproducible.
     */
    private Map<String, Resource> findDocuments(TemplateSource source, List<LoadError> errors) {
        Map<String, Resource> documents = new TreeMap<>(Comparator.naturalOrder());
        String base = trimSlash(source.getLocation());

        for (String extension : EXTENSIONS) {
            try {
                for (Resource resource : resolver.getResources(base + "/**/*." + extension)) {
                    if (resource.isReadable()) {
                        documents.put(pathOf(resource), resource);
                    }
                }
            } catch (IOException e) {
                log.warn("Cannot scan template source {}: {}", source.getLocation(), e.getMessage());
                errors.add(new LoadError(source.getLocation(), "cannot scan source: " + e.getMessage()));
                break;
            }
        }

        if (documents.isEmpty()) {
            log.debug("No template documents under {}", source.getLocation());
        }
        return documents;
    }

    private String read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String pathOf(Resource resource) throws IOException {
        return URLDecoder.decode(resource.getURL().toString(), StandardCharsets.UTF_8);
    }

    /**
     * Path relative to the source location, without extension: "pl/orange-polska".
     */
    static String deriveId(String location, String path) {
        String base = trimSlash(location.replaceFirst("^(classpath\\*?|file):", ""))
                .replace('\\', '/')
                .replaceFirst("^\\./", "");

        String relative = path;
        int at = base.isEmpty() ? -1 : path.lastIndexOf(base + "/");
        if (at >= 0) {
            relative = path.substring(at + base.length() + 1);
        } else {
            relative = relative.substring(relative.lastIndexOf('/') + 1);
        }

        int dot = relative.lastIndexOf('.');
        return dot > 0 ? relative.substring(0, dot) : relative;
    }

    private static String trimSlash(String location) {
        String trimmed = location.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}

package com.invoice.templates.controller;

import com.invoice.templates.exception.EmptyDocumentException;
import com.invoice.templates.model.ExtractionRequest;
import com.invoice.templates.model.MatchCandidate;
import com.invoice.templates.model.ReloadReport;
import com.invoice.templates.model.TemplateSummary;
import com.invoice.templates.service.TemplateMatcher;
import com.invoice.templates.service.TemplateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/templates")
@Slf4j
public class TemplateAdminController {

    private final TemplateRegistry registry;
    private final TemplateMatcher matcher;

    public TemplateAdminController(TemplateRegistry registry, TemplateMatcher matcher) {
        this.registry = registry;
        this.matcher = matcher;
    }

    @GetMapping
    public List<TemplateSummary> list() {
        return registry.current().all().stream()
                .map(TemplateSummary::of)
                .toList();
    }

    /**
     * Re-reads every template source. Broken documents are listed in the
     * report; the store is only replaced when at least one template loads.
     */
    @PostMapping("/reload")
    public ResponseEntity<ReloadReport> reload() {
        log.info("Template reload requested");
        return ResponseEntity.ok(ReloadReport.of(registry.reload()));
    }

    /**
     * Every candidate template for the text, best first.
     */
    @PostMapping("/match-report")
    public List<MatchCandidate> matchReport(@RequestBody ExtractionRequest request) {
        if (request.getText() == null || request.getText().isBlank()) {
            throw new EmptyDocumentException();
        }
        return matcher.rank(request.getText(), request.getLocale(), registry.current());
    }
}

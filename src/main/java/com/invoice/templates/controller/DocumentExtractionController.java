package com.invoice.templates.controller;

import com.invoice.templates.model.DocumentExtractionResponse;
import com.invoice.templates.model.ExtractionRequest;
import com.invoice.templates.service.DocumentExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/documents")
@Slf4j
public class DocumentExtractionController {

    private final DocumentExtractionService extractionService;

    public DocumentExtractionController(DocumentExtractionService extractionService) {
        this.extractionService = extractionService;
    }

    /**
     * Recognized text in, structured fields out. The template is chosen
     * automatically; a document no template accepts comes back as NO_MATCH.
     */
    @PostMapping("/extract")
    public ResponseEntity<DocumentExtractionResponse> extract(@RequestBody ExtractionRequest request) {
        DocumentExtractionResponse response =
                extractionService.process(request.getText(), request.getLocale(), request.getSource());
        return ResponseEntity.ok(response);
    }
}

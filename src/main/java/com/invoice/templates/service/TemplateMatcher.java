package com.invoice.templates.service;

import com.invoice.templates.config.ExtractionProperties;
import com.invoice.templates.loader.TemplateParser;
import com.invoice.templates.model.MatchCandidate;
import com.invoice.templates.template.DocumentTemplate;
import com.invoice.templates.template.IssuerSignature;
import com.invoice.templates.template.TemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores templates against document text:
 * keywordWeight * keywords found + fiscalIdWeight * fiscal id found + priorityWeight * priority.
 */
@Service
@Slf4j
public class TemplateMatcher {

    private static final Comparator<MatchCandidate> WINNER_FIRST =
            Comparator.comparingLong(MatchCandidate::getScore).reversed()
                    .thenComparing(Comparator.comparingInt(MatchCandidate::getPriority).reversed())
                    .thenComparing(MatchCandidate::getTemplateId);

    private final ExtractionProperties.Matching weights;

    public TemplateMatcher(ExtractionProperties properties) {
        this.weights = properties.getMatching();
        checkWeights(weights);
    }

    /**
     * Best template for the text, or empty when nothing qualifies.
     */
    public Optional<MatchCandidate> match(String text, String localeHint, TemplateStore store) {
        List<MatchCandidate> ranked = rank(text, localeHint, store);
        if (ranked.isEmpty()) {
            log.warn("No template matched (locale hint: {})", localeHint);
            return Optional.empty();
        }
        MatchCandidate winner = ranked.get(0);
        log.info("Matched template: {} (score: {}, keywords: {}, fiscal id: {})",
                winner.getTemplateId(), winner.getScore(), winner.getMatchedKeywords(), winner.isMatchedFiscalId());
        return Optional.of(winner);
    }

    /**
     * Every qualifying candidate, winner first.
     */
    public List<MatchCandidate> rank(String text, String localeHint, TemplateStore store) {
        String lowerText = text.toLowerCase(Locale.ROOT);
        String compactText = IssuerSignature.alphanumeric(text);

        List<MatchCandidate> candidates = new ArrayList<>();
        for (DocumentTemplate template : store.candidatesFor(TemplateParser.normalizeLocale(localeHint))) {
            score(template, lowerText, compactText).ifPresent(candidates::add);
        }
        candidates.sort(WINNER_FIRST);
        return candidates;
    }

    // ─── SCORING ───────────────────────────────────────────────────────────

    private Optional<MatchCandidate> score(DocumentTemplate template, String lowerText, String compactText) {
        IssuerSignature issuer = template.getIssuer();

        for (String exclude : issuer.getExcludeKeywords()) {
            if (lowerText.contains(exclude.toLowerCase(Locale.ROOT))) {
                log.debug("Template '{}' excluded by keyword '{}'", template.getId(), exclude);
                return Optional.empty();
            }
        }

        List<String> found = issuer.getKeywords().stream()
                .filter(k -> lowerText.contains(k.toLowerCase(Locale.ROOT)))
                .toList();
        boolean fiscalId = issuer.hasFiscalId() && compactText.contains(issuer.normalizedFiscalId());

        if (!issuer.isEmpty() && found.isEmpty() && !fiscalId) {
            log.debug("Template '{}': no issuer evidence", template.getId());
            return Optional.empty();
        }

        long score = weights.getKeywordWeight() * found.size()
                + (fiscalId ? weights.getFiscalIdWeight() : 0)
                + weights.getPriorityWeight() * template.getPriority();
        log.debug("Template '{}' scored {} points", template.getId(), score);

        // generic templates are the per-locale fallback and bypass the threshold
        if (!issuer.isEmpty() && score <= weights.getMinScore()) {
            log.debug("Template '{}' below minimum score {}", template.getId(), weights.getMinScore());
            return Optional.empty();
        }
        return Optional.of(MatchCandidate.builder()
                .templateId(template.getId())
                .score(score)
                .priority(template.getPriority())
                .matchedKeywords(found)
                .matchedFiscalId(fiscalId)
                .template(template)
                .build());
    }

    static void checkWeights(ExtractionProperties.Matching weights) {
        long priorityRange = weights.getPriorityWeight() * DocumentTemplate.MAX_PRIORITY;
        if (weights.getFiscalIdWeight() <= weights.getKeywordWeight()
                || weights.getKeywordWeight() <= priorityRange) {
            throw new IllegalStateException(String.format(
                    "Matcher weights must satisfy fiscalIdWeight > keywordWeight > priorityWeight * %d, got %d / %d / %d",
                    DocumentTemplate.MAX_PRIORITY, weights.getFiscalIdWeight(),
                    weights.getKeywordWeight(), weights.getPriorityWeight()));
        }
    }
}

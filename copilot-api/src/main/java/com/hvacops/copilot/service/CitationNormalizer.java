package com.hvacops.copilot.service;

import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.Evidence;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles model citations with the evidence the prompt was built from.
 *
 * <p>Model citations are kept only when every one names a document, a type and a snippet;
 * missing fields are then filled from the matching evidence record. Otherwise the evidence
 * itself is cited.</p>
 */
@Component
public class CitationNormalizer {

    static final int SNIPPET_LENGTH = 240;

    public List<Citation> normalize(List<Citation> modelCitations, List<Evidence> evidence) {
        List<Citation> fromEvidence = evidence.stream().map(this::fromEvidence).toList();
        if (modelCitations.isEmpty() || !modelCitations.stream().allMatch(this::complete)) {
            return fromEvidence;
        }
        Map<String, Citation> byDocId = new LinkedHashMap<>();
        for (Citation citation : fromEvidence) {
            if (citation.docId() != null) {
                byDocId.putIfAbsent(citation.docId(), citation);
            }
        }
        return modelCitations.stream()
                .map(citation -> merge(citation, byDocId.get(citation.docId())))
                .toList();
    }

    private boolean complete(Citation citation) {
        return citation.docId() != null && citation.snippet() != null && citation.type() != null;
    }

    private Citation fromEvidence(Evidence item) {
        String text = item.text() == null ? "" : item.text();
        String snippet = text.length() > SNIPPET_LENGTH ? text.substring(0, SNIPPET_LENGTH) : text;
        return new Citation(item.docId(), item.date(), item.type(), snippet, item.authorName(), item.authorEmail());
    }

    private Citation merge(Citation citation, Citation fallback) {
        if (fallback == null) {
            return citation;
        }
        return new Citation(
                citation.docId(),
                citation.date() != null ? citation.date() : fallback.date(),
                citation.type(),
                citation.snippet(),
                citation.authorName() != null ? citation.authorName() : fallback.authorName(),
                citation.authorEmail() != null ? citation.authorEmail() : fallback.authorEmail()
        );
    }
}

package com.hvacops.copilot.service.context;

import com.hvacops.copilot.model.Evidence;

import java.util.List;
import java.util.Map;

/**
 * Structured job snapshot plus the evidence retrieved for one question.
 */
public record JobContext(Map<String, Object> snapshot, String evidenceText, List<Evidence> evidence) {

    public JobContext {
        snapshot = snapshot == null ? Map.of() : snapshot;
        evidenceText = evidenceText == null ? "" : evidenceText;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}

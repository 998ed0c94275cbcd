package com.hvacops.copilot.client.mock;

import com.hvacops.copilot.client.model.CitationPayload;
import com.hvacops.copilot.client.model.CopilotReply;

import java.util.List;
import java.util.Locale;

/**
 * Canned answers used when no copilot backend is configured.
 */
public class OfflineMockResponder {

    static final String NOISE_ANSWER = "Yes, the notes mention intermittent rattling from the air handler. "
            + "The prior tech recommended tightening the blower mount on the next visit.";
    static final String GENERIC_ANSWER = "I can help with service history, equipment details, and recent notes. "
            + "Ask about repeat issues, last maintenance, or technician notes.";

    private static final CitationPayload NOISE_NOTE = new CitationPayload(
            "note_demo_1",
            "2024-11-12T17:40:00Z",
            "note",
            "Homeowner reported intermittent rattling from the air handler. "
                    + "Recommended tightening blower mount at next visit.",
            null,
            null
    );

    public CopilotReply respond(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("rattl") || lower.contains("noise")) {
            return new CopilotReply(null, NOISE_ANSWER, List.of(NOISE_NOTE),
                    List.of("Any parts replaced last visit?", "Show recent maintenance notes"), List.of());
        }
        return new CopilotReply(null, GENERIC_ANSWER, List.of(),
                List.of("Any repeat issues?", "When was the last maintenance?"), List.of());
    }
}

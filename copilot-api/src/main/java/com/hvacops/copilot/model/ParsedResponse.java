package com.hvacops.copilot.model;

import java.util.List;

public record ParsedResponse(String answer,
                             List<Citation> citations,
                             List<String> followUps) {

    public ParsedResponse {
        answer = answer == null ? "" : answer;
        citations = citations == null ? List.of() : List.copyOf(citations);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
    }
}

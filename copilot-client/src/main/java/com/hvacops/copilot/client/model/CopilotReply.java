package com.hvacops.copilot.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A finished copilot answer, as returned by the chat endpoint or carried by the terminal stream record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CopilotReply(@JsonProperty("conversation_id") String conversationId,
                           String answer,
                           List<CitationPayload> citations,
                           @JsonProperty("follow_ups") List<String> followUps,
                           List<EvidencePayload> evidence) {

    public CopilotReply {
        answer = answer == null ? "" : answer;
        citations = citations == null ? List.of() : citations;
        followUps = followUps == null ? List.of() : followUps;
        evidence = evidence == null ? List.of() : evidence;
    }
}

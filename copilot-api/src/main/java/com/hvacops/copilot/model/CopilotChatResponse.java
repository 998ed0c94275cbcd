package com.hvacops.copilot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CopilotChatResponse(@JsonProperty("conversation_id") String conversationId,
                                  String answer,
                                  List<Citation> citations,
                                  @JsonProperty("follow_ups") List<String> followUps,
                                  List<Evidence> evidence,
                                  Map<String, Object> debug) {

    public CopilotChatResponse {
        citations = citations == null ? List.of() : citations;
        followUps = followUps == null ? List.of() : followUps;
        evidence = evidence == null ? List.of() : evidence;
    }
}

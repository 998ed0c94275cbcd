package com.hvacops.copilot.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidencePayload(@JsonProperty("doc_id") String docId,
                              String date,
                              String type,
                              String text,
                              @JsonProperty("author_name") String authorName,
                              @JsonProperty("author_email") String authorEmail) {
}

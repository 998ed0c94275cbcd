package com.hvacops.copilot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retrieved source record. Richer than {@link Citation}; clients prefer it for display.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Evidence(@JsonProperty("doc_id") String docId,
                       String date,
                       String type,
                       String text,
                       @JsonProperty("author_name") String authorName,
                       @JsonProperty("author_email") String authorEmail) {
}

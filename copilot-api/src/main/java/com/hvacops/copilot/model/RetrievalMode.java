package com.hvacops.copilot.model;

public enum RetrievalMode {
    VECTOR,
    KEYWORD,
    HYBRID
}

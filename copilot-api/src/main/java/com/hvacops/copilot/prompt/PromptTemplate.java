package com.hvacops.copilot.prompt;

public record PromptTemplate(String version, String systemInstruction) {
}

package com.hvacops.copilot.model;

/**
 * Per-request model, retrieval and prompt settings.
 */
public record CopilotConfig(ModelSettings model,
                            RetrievalSettings retrieval,
                            PromptSettings prompt) {

    public static final String JSON_OBJECT = "json_object";
    public static final String BASELINE_PROMPT_VERSION = "copilot.v1";

    public CopilotConfig {
        model = model == null ? ModelSettings.defaults() : model;
        retrieval = retrieval == null ? RetrievalSettings.defaults() : retrieval;
        prompt = prompt == null ? PromptSettings.defaults() : prompt;
    }

    public static CopilotConfig defaults() {
        return new CopilotConfig(ModelSettings.defaults(), RetrievalSettings.defaults(), PromptSettings.defaults());
    }

    public record ModelSettings(String name,
                                double temperature,
                                Double topP,
                                Integer maxTokens,
                                String responseFormat) {

        public ModelSettings {
            name = name == null || name.isBlank() ? "gpt-4o" : name;
            responseFormat = responseFormat == null || responseFormat.isBlank() ? JSON_OBJECT : responseFormat;
        }

        public static ModelSettings defaults() {
            return new ModelSettings("gpt-4o", 0.2, null, null, JSON_OBJECT);
        }
    }

    public record RetrievalSettings(RetrievalMode mode,
                                    int topK,
                                    int fallbackTopK,
                                    int historyLimit) {

        public RetrievalSettings {
            mode = mode == null ? RetrievalMode.VECTOR : mode;
        }

        public static RetrievalSettings defaults() {
            return new RetrievalSettings(RetrievalMode.VECTOR, 6, 10, 25);
        }
    }

    public record PromptSettings(String version) {

        public static PromptSettings defaults() {
            return new PromptSettings(BASELINE_PROMPT_VERSION);
        }
    }
}

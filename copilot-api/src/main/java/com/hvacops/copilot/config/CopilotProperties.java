package com.hvacops.copilot.config;

import com.hvacops.copilot.model.CopilotConfig;
import com.hvacops.copilot.model.RetrievalMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "copilot")
public class CopilotProperties {

    private final Model model = new Model();
    private final Retrieval retrieval = new Retrieval();
    private final Prompt prompt = new Prompt();

    public Model getModel() {
        return model;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Prompt getPrompt() {
        return prompt;
    }

    public CopilotConfig toConfig() {
        return new CopilotConfig(
                new CopilotConfig.ModelSettings(model.getName(), model.getTemperature(), model.getTopP(),
                        model.getMaxTokens(), model.getResponseFormat()),
                new CopilotConfig.RetrievalSettings(retrieval.getMode(), retrieval.getTopK(),
                        retrieval.getFallbackTopK(), retrieval.getHistoryLimit()),
                new CopilotConfig.PromptSettings(prompt.getVersion())
        );
    }

    public static class Model {

        private String name = "gpt-4o";
        private double temperature = 0.2;
        private Double topP;
        private Integer maxTokens;
        private String responseFormat = CopilotConfig.JSON_OBJECT;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Double getTopP() {
            return topP;
        }

        public void setTopP(Double topP) {
            this.topP = topP;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public String getResponseFormat() {
            return responseFormat;
        }

        public void setResponseFormat(String responseFormat) {
            this.responseFormat = responseFormat;
        }
    }

    public static class Retrieval {

        private RetrievalMode mode = RetrievalMode.VECTOR;
        private int topK = 6;
        private int fallbackTopK = 10;
        /**
         * Maximum number of persisted turns replayed into the prompt.
         */
        private int historyLimit = 25;

        public RetrievalMode getMode() {
            return mode;
        }

        public void setMode(RetrievalMode mode) {
            this.mode = mode;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getFallbackTopK() {
            return fallbackTopK;
        }

        public void setFallbackTopK(int fallbackTopK) {
            this.fallbackTopK = fallbackTopK;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }

    public static class Prompt {

        private String version = CopilotConfig.BASELINE_PROMPT_VERSION;

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }
}

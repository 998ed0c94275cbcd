package com.hvacops.copilot.prompt;

import com.hvacops.copilot.model.CopilotConfig;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed set of versioned system instructions. Unknown versions resolve to the baseline.
 */
@Component
public class PromptTemplateRegistry {

    public static final String BASELINE_VERSION = CopilotConfig.BASELINE_PROMPT_VERSION;

    private static final String COPILOT_V1 = String.join(" ",
            "You are HVACOps Copilot helping a technician on a specific job.",
            "Only answer using the provided structured context.",
            "If evidence is provided, you MUST use it and cite it.",
            "If you do not see evidence, say you do not see it in the job history.",
            "Be concise and field-oriented.",
            "Citations must reference the provided evidence with doc_id, date, type, snippet.",
            "Return ONLY raw JSON with keys: answer, citations, follow_ups.");

    private final Map<String, PromptTemplate> templates;

    public PromptTemplateRegistry() {
        Map<String, PromptTemplate> registered = new LinkedHashMap<>();
        register(registered, new PromptTemplate(BASELINE_VERSION, COPILOT_V1));
        this.templates = Map.copyOf(registered);
    }

    public PromptTemplate resolve(String version) {
        if (version != null) {
            PromptTemplate template = templates.get(version.trim());
            if (template != null) {
                return template;
            }
        }
        return templates.get(BASELINE_VERSION);
    }

    public boolean isRegistered(String version) {
        return version != null && templates.containsKey(version.trim());
    }

    public Set<String> versions() {
        return templates.keySet();
    }

    private static void register(Map<String, PromptTemplate> registry, PromptTemplate template) {
        registry.put(template.version(), template);
    }
}

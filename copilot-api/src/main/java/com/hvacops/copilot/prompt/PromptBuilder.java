package com.hvacops.copilot.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Assembles the message sequence sent to the model:
 * instruction, structured context, prior history, then the current question.
 * Never throws and never touches the caller's history list.
 */
@Component
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    private final PromptTemplateRegistry registry;
    private final ObjectMapper objectMapper;

    public PromptBuilder(PromptTemplateRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    public List<ChatMessage> build(String version, PromptContext context) {
        PromptTemplate template = registry.resolve(version);
        if (!registry.isRegistered(version)) {
            log.debug("Unknown prompt version {}, using {}", version, template.version());
        }

        List<ChatMessage> history = context == null || context.history() == null ? List.of() : context.history();
        List<ChatMessage> messages = new ArrayList<>(history.size() + 3);
        messages.add(ChatMessage.system(template.systemInstruction()));
        messages.add(ChatMessage.system(contextBlock(context)));
        messages.addAll(history);
        messages.add(ChatMessage.user(context == null || context.userMessage() == null ? "" : context.userMessage()));
        return Collections.unmodifiableList(messages);
    }

    private String contextBlock(PromptContext context) {
        Map<String, Object> snapshot = context == null ? null : context.snapshot();
        String evidence = context == null || context.evidenceText() == null ? "" : context.evidenceText();
        return "Structured context:\n" + toJson(snapshot) + "\n\nEvidence (labeled sections):\n" + evidence;
    }

    private String toJson(Map<String, Object> snapshot) {
        if (snapshot == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.debug("Failed to serialize context snapshot", e);
            return "{}";
        }
    }
}

package com.hvacops.copilot.service.orchestration;

import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.service.orchestration.openai.OpenAiChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OpenAiModelProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiModelProvider.class);

    private final OpenAiChatClient chatClient;
    private final String apiKey;

    public OpenAiModelProvider(OpenAiChatClient chatClient,
                               @Value("${copilot.llm.api-key:}") String apiKey) {
        this.chatClient = chatClient;
        this.apiKey = apiKey;
    }

    @Override
    public ModelCompletion complete(ModelRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new CopilotConfigurationException("Missing OpenAI API key");
        }

        OpenAiChatClient.ChatCompletionResponse response = chatClient.complete(new OpenAiChatClient.Request(
                request.model(),
                toMessages(request.messages()),
                request.temperature(),
                request.topP(),
                request.maxTokens(),
                request.responseFormat()
        ));

        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null) {
            throw new ModelInvocationException("Chat completion returned no choices");
        }
        if ("length".equals(choice.finishReason())) {
            log.warn("Completion for model {} was truncated at max tokens", request.model());
        }
        return new ModelCompletion(choice.message().content(), toUsage(response.usage()));
    }

    @Override
    public String name() {
        return "openai";
    }

    private List<OpenAiChatClient.Message> toMessages(List<ChatMessage> messages) {
        return messages.stream()
                .map(message -> new OpenAiChatClient.Message(message.role().wireName(), message.content()))
                .toList();
    }

    private TokenUsage toUsage(OpenAiChatClient.Usage usage) {
        if (usage == null) {
            return null;
        }
        return new TokenUsage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens());
    }
}

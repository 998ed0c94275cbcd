package com.hvacops.copilot.service.orchestration;

import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.model.CopilotConfig;
import com.hvacops.copilot.model.CopilotRequest;
import com.hvacops.copilot.model.ParsedResponse;
import com.hvacops.copilot.prompt.PromptBuilder;
import com.hvacops.copilot.prompt.PromptContext;
import com.hvacops.copilot.telemetry.TelemetryEvent;
import com.hvacops.copilot.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs one request through prompt build, model invocation and parsing.
 *
 * <p>Emits {@code request.started}, {@code model.completed}, {@code response.parsed} and then
 * exactly one of {@code request.completed} / {@code request.failed}. Failures are rethrown
 * unchanged; there is no retry.</p>
 */
@Service
public class CopilotOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CopilotOrchestrator.class);

    private final PromptBuilder promptBuilder;
    private final ModelProvider modelProvider;
    private final ResponseParser responseParser;
    private final TelemetrySink telemetry;

    public CopilotOrchestrator(PromptBuilder promptBuilder,
                               ModelProvider modelProvider,
                               ResponseParser responseParser,
                               TelemetrySink telemetry) {
        this.promptBuilder = promptBuilder;
        this.modelProvider = modelProvider;
        this.responseParser = responseParser;
        this.telemetry = telemetry == null ? TelemetrySink.noop() : telemetry;
    }

    public ParsedResponse run(CopilotRequest request) {
        long startedAt = System.nanoTime();
        CopilotConfig config = request.config();

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("promptVersion", config.prompt().version());
        started.put("model", config.model().name());
        emit(request, TelemetryEvent.REQUEST_STARTED, started);

        try {
            List<ChatMessage> prompt = promptBuilder.build(config.prompt().version(), new PromptContext(
                    request.context(),
                    request.evidenceText(),
                    request.history(),
                    request.userInput()
            ));

            ModelCompletion completion = modelProvider.complete(new ModelRequest(
                    config.model().name(),
                    config.model().temperature(),
                    config.model().topP(),
                    config.model().maxTokens(),
                    config.model().responseFormat(),
                    prompt
            ));
            if (completion == null) {
                throw new ModelInvocationException("Model provider " + modelProvider.name() + " returned no completion");
            }

            Map<String, Object> completed = new LinkedHashMap<>();
            completed.put("model", config.model().name());
            completed.put("usage", completion.usage());
            emit(request, TelemetryEvent.MODEL_COMPLETED, completed);

            ParsedResponse parsed = responseParser.parse(completion.content());
            emit(request, TelemetryEvent.RESPONSE_PARSED, Map.of(
                    "citations", parsed.citations().size(),
                    "followUps", parsed.followUps().size()
            ));

            emit(request, TelemetryEvent.REQUEST_COMPLETED, Map.of("latencyMs", elapsedMillis(startedAt)));
            return parsed;
        } catch (RuntimeException ex) {
            emit(request, TelemetryEvent.REQUEST_FAILED, Map.of("error", String.valueOf(ex.getMessage())));
            throw ex;
        }
    }

    private void emit(CopilotRequest request, String name, Map<String, Object> payload) {
        try {
            telemetry.emit(new TelemetryEvent(name, request.requestId(), Instant.now(), payload));
        } catch (RuntimeException ex) {
            log.warn("Telemetry sink rejected {} for request {}", name, request.requestId(), ex);
        }
    }

    private long elapsedMillis(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
}

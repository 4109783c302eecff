package ai.shield.detect.backend;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.DetectorUnavailableException;
import ai.shield.llm.BackendInvoker;
import ai.shield.llm.ExternalServiceException;
import ai.shield.llm.LlmCompletion;
import ai.shield.llm.LlmRequest;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class BackendClassifierDetector implements Detector {
    private static final Logger log = LoggerFactory.getLogger(BackendClassifierDetector.class);

    private final DetectorKind kind;
    private final BackendInvoker invoker;
    private final ObjectMapper objectMapper;
    private final String model;
    private final String definition;
    private final String reason;

    public BackendClassifierDetector(
            DetectorKind kind,
            BackendInvoker invoker,
            ObjectMapper objectMapper,
            String model,
            String definition,
            String reason
    ) {
        this.kind = kind;
        this.invoker = invoker;
        this.objectMapper = objectMapper;
        this.model = model;
        this.definition = definition;
        this.reason = reason;
    }

    @Override
    public DetectorKind kind() {
        return kind;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.BACKEND_ASSISTED;
    }

    @Override
    public boolean isAvailable() {
        return invoker.isAvailable();
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        String systemPrompt = "You are a content-safety classifier. Estimate the probability that the text contains "
                + definition
                + ". Respond with JSON only: {\"score\": <number between 0 and 1>, \"reason\": \"<short reason>\"}.";
        LlmCompletion completion;
        try {
            completion = invoker.invoke(new LlmRequest(model, systemPrompt, "Text to classify:\n<<<\n" + text + "\n>>>"));
        } catch (ExternalServiceException e) {
            throw new DetectorUnavailableException(kind.key() + " classifier backend unavailable", e);
        }

        JsonNode reply = BackendReplies.parseObject(completion.text(), objectMapper);
        JsonNode score = reply.get("score");
        if (score == null || !score.isNumber()) {
            throw new DetectorUnavailableException(kind.key() + " classifier reply carried no score");
        }
        log.debug("event=backend_classification detector={} score={} reason={}",
                kind.key(), score.asDouble(), reply.path("reason").asText(""));
        return DetectionResult.scored(policy, score.asDouble(), reason, List.of());
    }
}

package ai.shield.detect.backend;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.DetectorUnavailableException;
import ai.shield.detect.Span;
import ai.shield.detect.Spans;
import ai.shield.llm.BackendInvoker;
import ai.shield.llm.ExternalServiceException;
import ai.shield.llm.LlmCompletion;
import ai.shield.llm.LlmRequest;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class BackendPiiDetector implements Detector {
    public static final String REASON = "backend_pii_match";
    private static final String DEFAULT_LABELS = "PERSON, LOCATION, ORGANIZATION, DATE, ADDRESS, ID_NUMBER";

    private final BackendInvoker invoker;
    private final ObjectMapper objectMapper;
    private final String model;

    public BackendPiiDetector(BackendInvoker invoker, ObjectMapper objectMapper, String model) {
        this.invoker = invoker;
        this.objectMapper = objectMapper;
        this.model = model;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.PII_REDACTION;
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
        Set<String> wanted = policy.entityTypes().stream()
                .map(label -> label.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String labels = wanted.isEmpty() ? DEFAULT_LABELS : String.join(", ", wanted);
        String systemPrompt = "You find personally identifiable information in text. Labels: " + labels
                + ". Ignore placeholders of the form [REDACTED_...]. Respond with JSON only: "
                + "{\"entities\": [{\"text\": \"<exact substring>\", \"label\": \"<LABEL>\"}]}.";

        LlmCompletion completion;
        try {
            completion = invoker.invoke(new LlmRequest(model, systemPrompt, text));
        } catch (ExternalServiceException e) {
            throw new DetectorUnavailableException("pii backend unavailable", e);
        }

        JsonNode entities = BackendReplies.parseObject(completion.text(), objectMapper).path("entities");
        List<Span> spans = new ArrayList<>();
        for (JsonNode entity : entities) {
            String value = entity.path("text").asText("");
            String label = entity.path("label").asText("PII").toUpperCase(Locale.ROOT);
            if (value.isBlank() || (!wanted.isEmpty() && !wanted.contains(label))) {
                continue;
            }
            int from = text.indexOf(value);
            while (from >= 0) {
                spans.add(new Span(from, from + value.length(), label));
                from = text.indexOf(value, from + value.length());
            }
        }
        return DetectionResult.spansFound(Spans.mergeOverlaps(spans), REASON);
    }
}

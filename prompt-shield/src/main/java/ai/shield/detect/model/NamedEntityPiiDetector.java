package ai.shield.detect.model;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.DetectorUnavailableException;
import ai.shield.detect.Span;
import ai.shield.detect.Spans;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class NamedEntityPiiDetector implements Detector {
    public static final String REASON = "named_entity_match";

    // spaCy-style labels accepted in policies
    private static final Map<String, String> ALIASES = Map.of(
            "PER", "PERSON",
            "GPE", "LOCATION",
            "LOC", "LOCATION",
            "ORG", "ORGANIZATION"
    );

    private final EntityGazetteer gazetteer;

    public NamedEntityPiiDetector(Optional<EntityGazetteer> gazetteer) {
        this.gazetteer = gazetteer.orElse(null);
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.PII_REDACTION;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.MODEL_BASED;
    }

    @Override
    public boolean isAvailable() {
        return gazetteer != null;
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        if (gazetteer == null) {
            throw new DetectorUnavailableException("entity gazetteer not loaded");
        }
        Set<String> wanted = normalize(policy.entityTypes());
        List<Span> spans = gazetteer.candidates(text).stream()
                .filter(span -> wanted.contains(span.label()))
                .toList();
        return DetectionResult.spansFound(Spans.mergeOverlaps(spans), REASON);
    }

    static Set<String> normalize(Set<String> labels) {
        Set<String> out = new HashSet<>();
        for (String label : labels) {
            String upper = label.toUpperCase(Locale.ROOT);
            out.add(ALIASES.getOrDefault(upper, upper));
        }
        return out;
    }
}

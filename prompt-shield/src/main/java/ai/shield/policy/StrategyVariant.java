package ai.shield.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum StrategyVariant {
    HEURISTIC("heuristic"),
    MODEL_BASED("ml"),
    BACKEND_ASSISTED("llm"),
    HYBRID("hybrid");

    private final String key;

    StrategyVariant(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Redaction passes a PII policy with this strategy runs, in order. The pattern pass is
     * always first.
     */
    public List<StrategyVariant> redactionPasses() {
        return switch (this) {
            case HEURISTIC -> List.of(HEURISTIC);
            case MODEL_BASED -> List.of(HEURISTIC, MODEL_BASED);
            case BACKEND_ASSISTED -> List.of(HEURISTIC, BACKEND_ASSISTED);
            case HYBRID -> List.of(HEURISTIC, MODEL_BASED, BACKEND_ASSISTED);
        };
    }

    public static Optional<StrategyVariant> fromKey(String key) {
        return Arrays.stream(values())
                .filter(variant -> variant.key.equals(key))
                .findFirst();
    }
}

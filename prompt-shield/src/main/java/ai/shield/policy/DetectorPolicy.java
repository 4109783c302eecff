package ai.shield.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

public record DetectorPolicy(
        DetectorKind kind,
        boolean enabled,
        StrategyVariant strategy,
        double threshold,
        @JsonProperty("entity_types") Set<String> entityTypes,
        List<String> markers,
        DetectorAction action
) {
    public DetectorPolicy {
        entityTypes = entityTypes == null ? Set.of() : Set.copyOf(entityTypes);
        markers = markers == null ? List.of() : List.copyOf(markers);
        action = action == null ? DetectorAction.BLOCK : action;
    }

    public static DetectorPolicy disabled(DetectorKind kind) {
        return new DetectorPolicy(kind, false, StrategyVariant.HEURISTIC, 0.5, Set.of(), List.of(), DetectorAction.BLOCK);
    }

    public boolean isPositive(double score) {
        return score >= threshold;
    }
}

package ai.shield.policy;

import java.util.Map;

public record ResponseScreeningPolicy(
        boolean enabled,
        Map<DetectorKind, DetectorPolicy> detectors
) {
    public ResponseScreeningPolicy {
        detectors = detectors == null ? Map.of() : Map.copyOf(detectors);
    }

    public static ResponseScreeningPolicy off() {
        return new ResponseScreeningPolicy(false, Map.of());
    }
}

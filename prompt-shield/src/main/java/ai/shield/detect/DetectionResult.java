package ai.shield.detect;

import ai.shield.policy.DetectorAction;
import ai.shield.policy.DetectorPolicy;

import java.util.List;

public record DetectionResult(
        Decision decision,
        Double score,
        String reason,
        List<Span> spans
) {
    public DetectionResult {
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    public static DetectionResult allow(Double score) {
        return new DetectionResult(Decision.ALLOW, score, null, List.of());
    }

    /**
     * Applies the policy threshold to {@code score}: at or above it the detector fires, with
     * the policy action deciding between block and flag.
     */
    public static DetectionResult scored(DetectorPolicy policy, double score, String reason, List<Span> spans) {
        double bounded = Math.max(0.0, Math.min(1.0, score));
        if (!policy.isPositive(bounded)) {
            return new DetectionResult(Decision.ALLOW, bounded, null, spans);
        }
        Decision decision = policy.action() == DetectorAction.FLAG ? Decision.FLAG : Decision.BLOCK;
        return new DetectionResult(decision, bounded, reason, spans);
    }

    public static DetectionResult spansFound(List<Span> spans, String reason) {
        if (spans.isEmpty()) {
            return new DetectionResult(Decision.ALLOW, null, null, List.of());
        }
        return new DetectionResult(Decision.FLAG, null, reason, spans);
    }

    public boolean isBlock() {
        return decision == Decision.BLOCK;
    }

    public boolean isPositive() {
        return decision == Decision.BLOCK || decision == Decision.FLAG;
    }
}

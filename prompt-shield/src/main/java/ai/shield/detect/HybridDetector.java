package ai.shield.detect;

import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical OR of a heuristic and a backend-assisted detector. The combined score is the
 * larger of the reported sub-scores. When the backend half is unavailable the heuristic
 * result stands alone and the reason records the gap.
 */
public class HybridDetector implements Detector {
    public static final String BACKEND_GAP = "backend_assist_unavailable";

    private final DetectorKind kind;
    private final Detector heuristic;
    private final Detector backend;

    public HybridDetector(DetectorKind kind, Detector heuristic, Detector backend) {
        this.kind = kind;
        this.heuristic = heuristic;
        this.backend = backend;
    }

    @Override
    public DetectorKind kind() {
        return kind;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.HYBRID;
    }

    @Override
    public boolean isAvailable() {
        return heuristic.isAvailable() || backend.isAvailable();
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        DetectionResult first = heuristic.isAvailable() ? heuristic.detect(text, policy) : null;
        DetectionResult second = null;
        if (backend.isAvailable()) {
            try {
                second = backend.detect(text, policy);
            } catch (DetectorUnavailableException e) {
                if (first == null) {
                    throw e;
                }
            }
        }
        if (first == null && second == null) {
            throw new DetectorUnavailableException(kind.key() + " hybrid has no available sub-strategy");
        }
        if (second == null) {
            return first.isPositive()
                    ? first
                    : new DetectionResult(first.decision(), first.score(), BACKEND_GAP, first.spans());
        }
        if (first == null) {
            return second;
        }
        return combine(first, second);
    }

    static DetectionResult combine(DetectionResult a, DetectionResult b) {
        Decision decision = a.decision().strongest(b.decision());
        Double score;
        if (a.score() != null && b.score() != null) {
            score = Math.max(a.score(), b.score());
        } else {
            score = a.score() != null ? a.score() : b.score();
        }
        String reason = a.isPositive() ? a.reason() : b.isPositive() ? b.reason() : null;
        List<Span> spans = new ArrayList<>(a.spans());
        spans.addAll(b.spans());
        return new DetectionResult(decision, score, reason, spans);
    }
}

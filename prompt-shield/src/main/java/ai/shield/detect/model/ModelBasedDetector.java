package ai.shield.detect.model;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.DetectorUnavailableException;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;

import java.util.List;
import java.util.Optional;

public class ModelBasedDetector implements Detector {
    private final DetectorKind kind;
    private final LexicalModel model;
    private final String reason;

    public ModelBasedDetector(DetectorKind kind, Optional<LexicalModel> model, String reason) {
        this.kind = kind;
        this.model = model.orElse(null);
        this.reason = reason;
    }

    @Override
    public DetectorKind kind() {
        return kind;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.MODEL_BASED;
    }

    @Override
    public boolean isAvailable() {
        return model != null;
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        if (model == null) {
            throw new DetectorUnavailableException(kind.key() + " model not loaded");
        }
        return DetectionResult.scored(policy, model.score(text), reason, List.of());
    }
}

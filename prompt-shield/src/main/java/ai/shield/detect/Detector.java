package ai.shield.detect;

import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;

public interface Detector {
    DetectorKind kind();

    StrategyVariant variant();

    /**
     * Whether the capability this detector needs (a model resource, a backend credential) is
     * present. Checked before every invocation.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @throws DetectorUnavailableException when the capability disappears mid-call
     */
    DetectionResult detect(String text, DetectorPolicy policy);
}

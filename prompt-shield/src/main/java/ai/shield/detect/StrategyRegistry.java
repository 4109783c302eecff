package ai.shield.detect;

import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.Policy;
import ai.shield.policy.PolicyValidator;
import ai.shield.policy.StrategyVariant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class StrategyRegistry implements PolicyValidator {
    private final Map<DetectorKind, Map<StrategyVariant, Detector>> detectors;

    public StrategyRegistry(List<Detector> registered) {
        Map<DetectorKind, Map<StrategyVariant, Detector>> byKind = new EnumMap<>(DetectorKind.class);
        for (Detector detector : registered) {
            Map<StrategyVariant, Detector> variants = byKind.computeIfAbsent(
                    detector.kind(), k -> new EnumMap<>(StrategyVariant.class));
            Detector previous = variants.put(detector.variant(), detector);
            if (previous != null) {
                throw new IllegalStateException("duplicate " + detector.variant().key()
                        + " detector for " + detector.kind().key());
            }
        }
        byKind.replaceAll((kind, variants) -> Map.copyOf(variants));
        this.detectors = Map.copyOf(byKind);
    }

    public Detector resolve(DetectorKind kind, StrategyVariant variant) {
        Detector detector = detectors.getOrDefault(kind, Map.of()).get(variant);
        if (detector == null) {
            throw new UnsupportedStrategyException(kind, variant);
        }
        return detector;
    }

    public boolean supports(DetectorKind kind, StrategyVariant variant) {
        return detectors.getOrDefault(kind, Map.of()).containsKey(variant);
    }

    @Override
    public void validate(Policy policy) {
        List<DetectorPolicy> enabled = new ArrayList<>();
        for (DetectorKind kind : DetectorKind.values()) {
            enabled.add(policy.detector(kind));
            enabled.add(policy.responseDetector(kind));
        }
        for (DetectorPolicy detector : enabled) {
            if (!detector.enabled()) {
                continue;
            }
            if (detector.kind() == DetectorKind.PII_REDACTION) {
                detector.strategy().redactionPasses().forEach(pass -> resolve(detector.kind(), pass));
            } else {
                resolve(detector.kind(), detector.strategy());
            }
        }
    }
}

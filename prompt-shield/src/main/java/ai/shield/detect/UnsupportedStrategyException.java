package ai.shield.detect;

import ai.shield.policy.DetectorKind;
import ai.shield.policy.StrategyVariant;

public class UnsupportedStrategyException extends RuntimeException {
    public UnsupportedStrategyException(DetectorKind kind, StrategyVariant variant) {
        super("no " + variant.key() + " strategy registered for " + kind.key());
    }
}

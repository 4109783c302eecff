package ai.shield.detect;

import ai.shield.policy.DetectorKind;
import ai.shield.policy.StrategyVariant;
import ai.shield.support.Fixtures;
import ai.shield.support.ScriptedLlmClient;
import ai.shield.support.StubDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {
    @AfterEach
    void closePools() {
        Fixtures.closePools();
    }

    @Test
    void shouldResolveEveryRegisteredPair() {
        StrategyRegistry registry = Fixtures.registry(Fixtures.invoker(ScriptedLlmClient.replying("{}"), 500, 1));

        for (StrategyVariant variant : StrategyVariant.values()) {
            assertEquals(variant, registry.resolve(DetectorKind.PROMPT_INJECTION, variant).variant());
            assertEquals(variant, registry.resolve(DetectorKind.HARMFUL_CONTENT, variant).variant());
        }
        assertTrue(registry.supports(DetectorKind.PII_REDACTION, StrategyVariant.MODEL_BASED));
        assertFalse(registry.supports(DetectorKind.PII_REDACTION, StrategyVariant.HYBRID));
    }

    @Test
    void shouldRejectUnsupportedPair() {
        StrategyRegistry registry = new StrategyRegistry(List.of(
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, 0.0)));

        UnsupportedStrategyException e = assertThrows(UnsupportedStrategyException.class,
                () -> registry.resolve(DetectorKind.PROMPT_INJECTION, StrategyVariant.MODEL_BASED));
        assertTrue(e.getMessage().contains("ml"));
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        assertThrows(IllegalStateException.class, () -> new StrategyRegistry(List.of(
                StubDetector.scoring(DetectorKind.HARMFUL_CONTENT, StrategyVariant.HEURISTIC, 0.0),
                StubDetector.scoring(DetectorKind.HARMFUL_CONTENT, StrategyVariant.HEURISTIC, 1.0))));
    }

    @Test
    void shouldFailValidationForUnresolvablePolicy() {
        StrategyRegistry registry = new StrategyRegistry(List.of(
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, 0.0)));

        assertThrows(UnsupportedStrategyException.class, () -> registry.validate(Fixtures.policy(Fixtures.DEFAULT_POLICY)));
    }

    @Test
    void shouldAcceptPolicyWhenAllPassesResolve() {
        StrategyRegistry registry = Fixtures.registry(Fixtures.invoker(ScriptedLlmClient.replying("{}"), 500, 1));
        assertDoesNotThrow(() -> registry.validate(Fixtures.policy(Fixtures.DEFAULT_POLICY)));
    }
}

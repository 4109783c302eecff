package ai.shield.detect;

import ai.shield.policy.DetectorAction;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import ai.shield.support.StubDetector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HybridDetectorTest {
    private static final DetectorPolicy POLICY = new DetectorPolicy(DetectorKind.PROMPT_INJECTION, true,
            StrategyVariant.HYBRID, 0.5, Set.of(), List.of(), DetectorAction.BLOCK);

    @Test
    void shouldBlockWhenEitherHalfBlocks() {
        double[][] cases = {{0.0, 0.0}, {0.9, 0.0}, {0.0, 0.9}, {0.9, 0.8}};
        for (double[] scores : cases) {
            HybridDetector hybrid = hybrid(scores[0], scores[1]);
            DetectionResult result = hybrid.detect("text", POLICY);

            boolean expectBlock = scores[0] >= 0.5 || scores[1] >= 0.5;
            assertEquals(expectBlock, result.isBlock(), scores[0] + "/" + scores[1]);
            assertEquals(Math.max(scores[0], scores[1]), result.score(), 1e-9);
        }
    }

    @Test
    void shouldFallBackToHeuristicWhenBackendUnavailable() {
        HybridDetector hybrid = new HybridDetector(DetectorKind.PROMPT_INJECTION,
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, 0.1),
                new StubDetector(DetectorKind.PROMPT_INJECTION, StrategyVariant.BACKEND_ASSISTED, false,
                        (text, policy) -> fail("backend must not be called")));

        DetectionResult result = hybrid.detect("text", POLICY);

        assertEquals(Decision.ALLOW, result.decision());
        assertEquals(HybridDetector.BACKEND_GAP, result.reason());
    }

    @Test
    void shouldKeepHeuristicBlockWhenBackendThrows() {
        HybridDetector hybrid = new HybridDetector(DetectorKind.PROMPT_INJECTION,
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, 1.0),
                new StubDetector(DetectorKind.PROMPT_INJECTION, StrategyVariant.BACKEND_ASSISTED, true,
                        (text, policy) -> {
                            throw new DetectorUnavailableException("down");
                        }));

        assertTrue(hybrid.detect("text", POLICY).isBlock());
    }

    @Test
    void shouldBeUnavailableOnlyWhenBothHalvesAre() {
        HybridDetector none = new HybridDetector(DetectorKind.PROMPT_INJECTION,
                new StubDetector(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, false, (t, p) -> null),
                new StubDetector(DetectorKind.PROMPT_INJECTION, StrategyVariant.BACKEND_ASSISTED, false, (t, p) -> null));

        assertFalse(none.isAvailable());
        assertThrows(DetectorUnavailableException.class, () -> none.detect("text", POLICY));
    }

    private static HybridDetector hybrid(double heuristicScore, double backendScore) {
        return new HybridDetector(DetectorKind.PROMPT_INJECTION,
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.HEURISTIC, heuristicScore),
                StubDetector.scoring(DetectorKind.PROMPT_INJECTION, StrategyVariant.BACKEND_ASSISTED, backendScore));
    }
}

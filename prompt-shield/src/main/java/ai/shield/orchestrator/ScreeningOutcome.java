package ai.shield.orchestrator;

import ai.shield.detect.Decision;

import java.util.List;

public record ScreeningOutcome(
        Decision decision,
        String step,
        String reason,
        List<String> flagged
) {
    public ScreeningOutcome {
        flagged = List.copyOf(flagged);
    }

    public static ScreeningOutcome allowed(List<String> flagged) {
        return new ScreeningOutcome(Decision.ALLOW, null, null, flagged);
    }

    public static ScreeningOutcome blocked(String step, String reason, List<String> flagged) {
        return new ScreeningOutcome(Decision.BLOCK, step, reason, flagged);
    }

    public boolean isBlocked() {
        return decision == Decision.BLOCK;
    }
}

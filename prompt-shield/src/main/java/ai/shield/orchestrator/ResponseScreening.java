package ai.shield.orchestrator;

import ai.shield.redact.RedactionResult;

public record ResponseScreening(
        ScreeningOutcome outcome,
        String text,
        RedactionResult redaction
) {
    public boolean isBlocked() {
        return outcome.isBlocked();
    }

    public boolean isRedacted() {
        return redaction != null && redaction.redacted();
    }
}

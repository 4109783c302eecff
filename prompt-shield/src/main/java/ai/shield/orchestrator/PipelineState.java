package ai.shield.orchestrator;

import java.util.EnumSet;
import java.util.Set;

public enum PipelineState {
    RECEIVED,
    INPUT_SCREENING,
    BLOCKED_INPUT,
    REDACTING,
    BACKEND_INVOCATION,
    OUTPUT_SCREENING,
    BLOCKED_OUTPUT,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == BLOCKED_INPUT || this == BLOCKED_OUTPUT || this == COMPLETED || this == CANCELLED;
    }

    public boolean canMoveTo(PipelineState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<PipelineState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(INPUT_SCREENING);
            case INPUT_SCREENING -> EnumSet.of(BLOCKED_INPUT, REDACTING);
            case REDACTING -> EnumSet.of(BACKEND_INVOCATION);
            case BACKEND_INVOCATION -> EnumSet.of(OUTPUT_SCREENING, BLOCKED_OUTPUT);
            case OUTPUT_SCREENING -> EnumSet.of(BLOCKED_OUTPUT, COMPLETED);
            default -> EnumSet.noneOf(PipelineState.class);
        };
    }
}

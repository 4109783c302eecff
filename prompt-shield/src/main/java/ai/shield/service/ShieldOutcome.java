package ai.shield.service;

import ai.shield.trace.TraceStep;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public record ShieldOutcome(
        String requestId,
        Status status,
        String reason,
        String originalPrompt,
        String processedPrompt,
        String llmResponse,
        String llmOutputBlocked,
        List<TraceStep> trace
) {
    /** Stands in for generated text that screening withheld. */
    public static final String WITHHELD = "[response withheld by content policy]";

    public enum Status {
        SUCCESS("success"),
        BLOCKED("blocked"),
        BLOCKED_RESPONSE("blocked_response");

        private final String key;

        Status(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }
    }

    public ShieldOutcome {
        trace = List.copyOf(trace);
    }

    static ShieldOutcome success(String requestId, String original, String processed, String response, List<TraceStep> trace) {
        return new ShieldOutcome(requestId, Status.SUCCESS, null, original, processed, response, null, trace);
    }

    static ShieldOutcome blocked(String requestId, String reason, String original, List<TraceStep> trace) {
        return new ShieldOutcome(requestId, Status.BLOCKED, reason, original, null, null, null, trace);
    }

    static ShieldOutcome blockedResponse(String requestId, String reason, String original, List<TraceStep> trace) {
        return new ShieldOutcome(requestId, Status.BLOCKED_RESPONSE, reason, original, null, null, WITHHELD, trace);
    }

    public boolean isBlocked() {
        return status != Status.SUCCESS;
    }
}

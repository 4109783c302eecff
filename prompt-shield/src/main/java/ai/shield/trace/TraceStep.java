package ai.shield.trace;

import ai.shield.detect.Decision;
import ai.shield.policy.StrategyVariant;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"sequence_index", "step", "strategy", "decision", "reason"})
public record TraceStep(
        @JsonProperty("sequence_index") int sequenceIndex,
        @JsonProperty("step") String stepName,
        @JsonProperty("strategy") StrategyVariant strategyUsed,
        Decision decision,
        @JsonInclude(JsonInclude.Include.NON_NULL) String reason
) {}

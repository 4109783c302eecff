package ai.shield.api.model;

import ai.shield.service.ShieldOutcome;
import ai.shield.trace.TraceStep;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShieldPromptResponse(
        @JsonProperty("request_id") String requestId,
        String status,
        String reason,
        @JsonProperty("original_prompt") String originalPrompt,
        @JsonProperty("processed_prompt") String processedPrompt,
        @JsonProperty("llm_response") String llmResponse,
        @JsonProperty("llm_output_blocked") String llmOutputBlocked,
        List<TraceStep> trace
) {
    public static ShieldPromptResponse from(ShieldOutcome outcome) {
        return new ShieldPromptResponse(
                outcome.requestId(),
                outcome.status().key(),
                outcome.reason(),
                outcome.originalPrompt(),
                outcome.processedPrompt(),
                outcome.llmResponse(),
                outcome.llmOutputBlocked(),
                outcome.trace()
        );
    }
}

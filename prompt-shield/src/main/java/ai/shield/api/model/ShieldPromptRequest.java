package ai.shield.api.model;

import ai.shield.service.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ShieldPromptRequest(
        Object prompt,
        @JsonProperty("session_id") String sessionId
) {
    public String promptText() {
        if (prompt == null) {
            throw new ValidationException("Please provide a 'prompt' in the request body.");
        }
        if (!(prompt instanceof String text)) {
            throw new ValidationException("'prompt' must be a string.");
        }
        return text;
    }
}

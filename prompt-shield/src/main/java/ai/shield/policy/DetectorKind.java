package ai.shield.policy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DetectorKind {
    HARMFUL_CONTENT("harmful_content", true),
    PROMPT_INJECTION("prompt_injection", true),
    PII_REDACTION("pii_redaction", false);

    private final String key;
    private final boolean screening;

    DetectorKind(String key, boolean screening) {
        this.key = key;
        this.screening = screening;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Screening kinds produce allow/block/flag decisions and run inside the detection
     * orchestrator; the PII kind only feeds the redaction engine.
     */
    public boolean isScreening() {
        return screening;
    }

    public static Optional<DetectorKind> fromKey(String key) {
        return Arrays.stream(values())
                .filter(kind -> kind.key.equals(key))
                .findFirst();
    }
}

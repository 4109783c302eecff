package ai.shield.detect;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Decision {
    ALLOW("allow", 0),
    FLAG("flag", 1),
    BLOCK("block", 2),
    REDACTED("redacted", 1);

    private final String key;
    private final int severity;

    Decision(String key, int severity) {
        this.key = key;
        this.severity = severity;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Decision strongest(Decision other) {
        return other.severity > severity ? other : this;
    }
}

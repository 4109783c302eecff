package ai.shield.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectorAction {
    BLOCK("block"),
    FLAG("flag");

    private final String key;

    DetectorAction(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}

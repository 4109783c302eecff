package ai.shield.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FailMode {
    OPEN("open"),
    CLOSED("closed");

    private final String key;

    FailMode(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String reasonFor(String subject) {
        return subject + "_unavailable_fail_" + key;
    }
}

package ai.shield.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ShieldEvent(
        @JsonProperty("event_type") EventType eventType,
        Instant timestamp,
        String preview,
        Map<String, String> metadata
) {
    private static final String ELLIPSIS = "…";

    public ShieldEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Cuts {@code text} so the result, ellipsis included, is at most {@code maxLength} characters. */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(0, maxLength));
        }
        int cut = maxLength - ELLIPSIS.length();
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + ELLIPSIS;
    }
}

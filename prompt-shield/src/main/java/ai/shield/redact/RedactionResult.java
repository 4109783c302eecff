package ai.shield.redact;

import ai.shield.detect.Span;

import java.util.List;

public record RedactionResult(
        String redactedText,
        List<Span> entitiesRemoved,
        List<String> skippedPasses
) {
    public RedactionResult {
        entitiesRemoved = List.copyOf(entitiesRemoved);
        skippedPasses = List.copyOf(skippedPasses);
    }

    public static RedactionResult unchanged(String text) {
        return new RedactionResult(text, List.of(), List.of());
    }

    public boolean redacted() {
        return !entitiesRemoved.isEmpty();
    }

    public String labelSummary() {
        return String.join(",", entitiesRemoved.stream().map(Span::label).distinct().sorted().toList());
    }

    /** Trace reason: the skipped passes, if any. */
    public String traceReason() {
        return skippedPasses.isEmpty() ? null : String.join(",", skippedPasses);
    }
}

package ai.shield.redact;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.Span;
import ai.shield.detect.Spans;
import ai.shield.detect.StrategyRegistry;
import ai.shield.detect.UnsupportedStrategyException;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Each pass sees the text already masked by the passes before it; spans touching a mask are dropped.
@Component
public class RedactionEngine {
    private static final Logger log = LoggerFactory.getLogger(RedactionEngine.class);

    public static final Pattern MASK = Pattern.compile("\\[REDACTED_[A-Z_]+\\]");
    public static final String PATTERN_PASS_FAILED = "pattern_pass_unavailable";
    public static final String NAMED_ENTITY_PASS_UNAVAILABLE = "named_entity_pass_unavailable";
    public static final String BACKEND_PASS_UNAVAILABLE = "backend_pass_unavailable";

    private final StrategyRegistry registry;

    public RedactionEngine(StrategyRegistry registry) {
        this.registry = registry;
    }

    public static String mask(String label) {
        String normalized = label.toUpperCase(Locale.ROOT).replaceAll("[^A-Z_]", "_");
        return "[REDACTED_" + (normalized.isEmpty() ? "PII" : normalized) + "]";
    }

    public RedactionResult redact(String text, DetectorPolicy policy) {
        if (!policy.enabled() || text == null || text.isEmpty()) {
            return RedactionResult.unchanged(text);
        }

        List<Span> existing = new ArrayList<>();
        Matcher matcher = MASK.matcher(text);
        while (matcher.find()) {
            existing.add(new Span(matcher.start(), matcher.end(), "MASK"));
        }

        List<Span> accepted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (StrategyVariant pass : policy.strategy().redactionPasses()) {
            String skipReason = skipReason(pass);
            if (pass == StrategyVariant.MODEL_BASED && policy.entityTypes().isEmpty()) {
                skipped.add(skipReason);
                continue;
            }
            Detector detector;
            try {
                detector = registry.resolve(DetectorKind.PII_REDACTION, pass);
            } catch (UnsupportedStrategyException e) {
                skipped.add(skipReason);
                continue;
            }
            if (!detector.isAvailable()) {
                skipped.add(skipReason);
                continue;
            }

            Rendering view = render(text, existing, accepted);
            DetectionResult result;
            try {
                result = detector.detect(view.text(), policy);
            } catch (RuntimeException e) {
                log.warn("event=redaction_pass_failed pass={} reason={}", pass.key(), e.getMessage());
                skipped.add(skipReason);
                continue;
            }
            List<Span> mapped = new ArrayList<>();
            for (Span found : result.spans()) {
                Span original = view.toOriginal(found);
                if (original != null) {
                    mapped.add(original);
                }
            }
            accepted.addAll(Spans.mergeOverlaps(mapped));
        }

        accepted.sort(Comparator.comparingInt(Span::start));
        String redacted = render(text, existing, accepted).text();
        return new RedactionResult(redacted, accepted, skipped);
    }

    /**
     * Redacts with the local passes only, whether or not the policy enables redaction. Used for
     * text that is about to be logged; never calls the backend.
     */
    public String redactLocally(String text, DetectorPolicy policy) {
        boolean entities = policy.enabled()
                && !policy.entityTypes().isEmpty()
                && policy.strategy().redactionPasses().contains(StrategyVariant.MODEL_BASED);
        DetectorPolicy local = new DetectorPolicy(DetectorKind.PII_REDACTION, true,
                entities ? StrategyVariant.MODEL_BASED : StrategyVariant.HEURISTIC,
                policy.threshold(), policy.entityTypes(), policy.markers(), policy.action());
        return redact(text, local).redactedText();
    }

    private static String skipReason(StrategyVariant pass) {
        return switch (pass) {
            case HEURISTIC -> PATTERN_PASS_FAILED;
            case MODEL_BASED -> NAMED_ENTITY_PASS_UNAVAILABLE;
            default -> BACKEND_PASS_UNAVAILABLE;
        };
    }

    /**
     * Builds the masked text and remembers, for each untouched stretch, where it sits in both
     * texts.
     */
    static Rendering render(String text, List<Span> existing, List<Span> accepted) {
        List<Span> regions = new ArrayList<>(existing);
        regions.addAll(accepted);
        regions.sort(Comparator.comparingInt(Span::start));

        StringBuilder out = new StringBuilder(text.length());
        List<int[]> segments = new ArrayList<>();
        List<int[]> masks = new ArrayList<>();
        int cursor = 0;
        for (Span region : regions) {
            if (region.start() > cursor) {
                segments.add(new int[] {out.length(), out.length() + region.start() - cursor, cursor});
                out.append(text, cursor, region.start());
            }
            int maskStart = out.length();
            if (existing.contains(region)) {
                out.append(text, region.start(), region.end());
            } else {
                out.append(mask(region.label()));
            }
            masks.add(new int[] {maskStart, out.length()});
            cursor = region.end();
        }
        if (cursor < text.length()) {
            segments.add(new int[] {out.length(), out.length() + text.length() - cursor, cursor});
            out.append(text, cursor, text.length());
        }
        return new Rendering(out.toString(), segments, masks);
    }

    record Rendering(String text, List<int[]> segments, List<int[]> masks) {
        /** Maps a span of the rendered text to the input, or null when it is not fully inside one untouched stretch. */
        Span toOriginal(Span span) {
            for (int[] mask : masks) {
                if (span.start() < mask[1] && mask[0] < span.end()) {
                    return null;
                }
            }
            for (int[] segment : segments) {
                if (span.start() >= segment[0] && span.end() <= segment[1]) {
                    int shift = segment[2] - segment[0];
                    return new Span(span.start() + shift, span.end() + shift, span.label());
                }
            }
            return null;
        }
    }
}

package ai.shield.detect.heuristic;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.Span;
import ai.shield.detect.Spans;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Boundaries exclude square brackets so nothing next to a [REDACTED_...] mask starts or ends a match.
@Component
public class PiiPatternDetector implements Detector {
    public static final String REASON = "pii_pattern_match";

    private static final String BEFORE = "(?<![\\w\\[\\]])";
    private static final String AFTER = "(?![\\w\\[\\]])";

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("EMAIL", Pattern.compile(BEFORE
                + "[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(?:\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}"));
        PATTERNS.put("SSN", Pattern.compile(BEFORE + "\\d{3}-\\d{2}-\\d{4}" + AFTER));
        PATTERNS.put("CREDIT_CARD", Pattern.compile(BEFORE + "\\d(?:[ -]?\\d){12,18}" + AFTER));
        PATTERNS.put("PHONE", Pattern.compile(
                BEFORE + "(?:\\+\\d{1,3}[ .-]?)?(?:\\(\\d{3}\\)|\\d{3})[ .-]?\\d{3}[ .-]?\\d{4}" + AFTER));
        PATTERNS.put("IP_ADDRESS", Pattern.compile(
                "(?<![\\w.\\[\\]])(?:(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1?\\d?\\d)(?![\\w.\\[\\]])"));
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.PII_REDACTION;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.HEURISTIC;
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        List<Span> candidates = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find()) {
                if (entry.getKey().equals("CREDIT_CARD") && !luhnValid(matcher.group())) {
                    continue;
                }
                candidates.add(new Span(matcher.start(), matcher.end(), entry.getKey()));
            }
        }
        return DetectionResult.spansFound(Spans.mergeOverlaps(candidates), REASON);
    }

    static boolean luhnValid(String candidate) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = candidate.length() - 1; i >= 0; i--) {
            char c = candidate.charAt(i);
            if (!Character.isDigit(c)) {
                continue;
            }
            int digit = c - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }
}

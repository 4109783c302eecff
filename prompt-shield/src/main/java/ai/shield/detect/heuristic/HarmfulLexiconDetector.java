package ai.shield.detect.heuristic;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.Span;
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

@Component
public class HarmfulLexiconDetector implements Detector {
    public static final String REASON = "harmful_content_detected";

    private static final Map<String, Pattern> CATEGORIES = new LinkedHashMap<>();

    static {
        CATEGORIES.put("VIOLENCE", lexicon(
                "how to (?:make|build) (?:a )?(?:pipe )?bomb",
                "(?:make|build) (?:an? )?explosives?",
                "kill (?:him|her|them|someone|everyone|people)",
                "mass shooting",
                "poison (?:someone|him|her|them)"));
        CATEGORIES.put("SELF_HARM", lexicon(
                "kill myself",
                "end my life",
                "want to die",
                "ways to commit suicide",
                "how to self[- ]harm"));
        CATEGORIES.put("WEAPONS", lexicon(
                "untraceable (?:gun|firearm)",
                "3d[- ]printed (?:gun|firearm)",
                "convert (?:a )?(?:rifle|gun) to (?:full[- ])?auto"));
        CATEGORIES.put("HATE", lexicon(
                "exterminate (?:all )?(?:the )?\\p{L}+",
                "(?:are|is) subhuman",
                "ethnic cleansing"));
        CATEGORIES.put("ILLICIT_DRUGS", lexicon(
                "synthesi[sz]e (?:meth|methamphetamine|fentanyl)",
                "cook (?:meth|crack)"));
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.HARMFUL_CONTENT;
    }

    @Override
    public StrategyVariant variant() {
        return StrategyVariant.HEURISTIC;
    }

    @Override
    public DetectionResult detect(String text, DetectorPolicy policy) {
        List<Span> spans = new ArrayList<>();
        for (Map.Entry<String, Pattern> category : CATEGORIES.entrySet()) {
            Matcher matcher = category.getValue().matcher(text);
            while (matcher.find()) {
                spans.add(new Span(matcher.start(), matcher.end(), category.getKey()));
            }
        }
        spans.addAll(MarkerPatterns.find(text, policy.markers(), "CUSTOM"));
        spans.sort((a, b) -> Integer.compare(a.start(), b.start()));

        double score = 1.0 - Math.pow(0.5, spans.size());
        return DetectionResult.scored(policy, score, REASON, spans);
    }

    private static Pattern lexicon(String... phrases) {
        return Pattern.compile(
                "(?<![\\p{L}\\p{N}])(?:" + String.join("|", phrases) + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

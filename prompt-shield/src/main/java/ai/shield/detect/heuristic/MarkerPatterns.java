package ai.shield.detect.heuristic;

import ai.shield.detect.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles configured marker phrases into whitespace-tolerant, case-insensitive patterns.
 * Compiled patterns are cached per phrase since policies repeat the same lists.
 */
final class MarkerPatterns {
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private MarkerPatterns() {}

    static Pattern compile(String phrase) {
        return CACHE.computeIfAbsent(phrase, MarkerPatterns::build);
    }

    static List<Span> find(String text, List<String> phrases, String label) {
        List<Span> spans = new ArrayList<>();
        for (String phrase : phrases) {
            Matcher matcher = compile(phrase).matcher(text);
            while (matcher.find()) {
                spans.add(new Span(matcher.start(), matcher.end(), label));
            }
        }
        spans.sort((a, b) -> Integer.compare(a.start(), b.start()));
        return spans;
    }

    private static Pattern build(String phrase) {
        String[] words = phrase.trim().split("\\s+");
        StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append("(?![\\p{L}\\p{N}])");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

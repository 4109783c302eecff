package ai.shield.detect.model;

import ai.shield.detect.Span;
import ai.shield.detect.Spans;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class EntityGazetteer {
    private static final Logger log = LoggerFactory.getLogger(EntityGazetteer.class);

    private static final String MONTHS =
            "January|February|March|April|May|June|July|August|September|October|November|December";
    private static final Pattern HONORIFIC_PERSON = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:Dr|Mr|Mrs|Ms|Miss|Prof)\\.?\\s+\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+)?");
    private static final Pattern DATE = Pattern.compile(
            "(?<![\\w\\[\\]])(?:\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{2,4}|(?:" + MONTHS + ")\\s+\\d{1,2}(?:,\\s*\\d{4})?)(?![\\w\\[\\]])");

    private final Map<String, Pattern> phrases;
    private final Pattern firstNamePerson;

    public EntityGazetteer(Map<String, List<String>> entries, List<String> firstNames) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : entries.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                compiled.put(entry.getKey(), alternation(entry.getValue()));
            }
        }
        this.phrases = compiled;
        this.firstNamePerson = firstNames.isEmpty()
                ? null
                : Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + quoteAll(firstNames) + ")\\s+\\p{Lu}[\\p{L}'-]+(?![\\p{L}\\p{N}])");
    }

    public static Optional<EntityGazetteer> tryLoad(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("event=gazetteer_missing resource={}", resource.getDescription());
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Map<String, List<String>> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("entities").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), strings(field.getValue()));
            }
            EntityGazetteer gazetteer = new EntityGazetteer(entries, strings(root.path("first_names")));
            log.info("event=gazetteer_loaded resource={} labels={}", resource.getDescription(), entries.keySet());
            return Optional.of(gazetteer);
        } catch (IOException e) {
            log.warn("event=gazetteer_unreadable resource={} reason={}", resource.getDescription(), e.getMessage());
            return Optional.empty();
        }
    }

    public List<Span> recognize(String text) {
        return Spans.mergeOverlaps(candidates(text));
    }

    /** Every match of every label, overlaps included. */
    public List<Span> candidates(String text) {
        List<Span> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : phrases.entrySet()) {
            collect(entry.getValue(), text, entry.getKey(), found);
        }
        collect(HONORIFIC_PERSON, text, "PERSON", found);
        if (firstNamePerson != null) {
            collect(firstNamePerson, text, "PERSON", found);
        }
        collect(DATE, text, "DATE", found);
        return found;
    }

    private static void collect(Pattern pattern, String text, String label, List<Span> out) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            out.add(new Span(matcher.start(), matcher.end(), label));
        }
    }

    private static Pattern alternation(List<String> values) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + quoteAll(values) + ")(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String quoteAll(List<String> values) {
        List<String> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        List<String> quoted = new ArrayList<>();
        for (String value : sorted) {
            quoted.add(Pattern.quote(value));
        }
        return String.join("|", quoted);
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            String value = item.asText("").trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return out;
    }
}

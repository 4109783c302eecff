package ai.shield.detect.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class LexicalModel {
    private static final Logger log = LoggerFactory.getLogger(LexicalModel.class);

    private final String name;
    private final double bias;
    private final Map<String, Double> weights;

    public LexicalModel(String name, double bias, Map<String, Double> weights) {
        this.name = name;
        this.bias = bias;
        this.weights = Map.copyOf(weights);
    }

    public static Optional<LexicalModel> tryLoad(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("event=model_missing resource={}", resource.getDescription());
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Map<String, Double> weights = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("weights").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                weights.put(field.getKey().toLowerCase(Locale.ROOT), field.getValue().asDouble());
            }
            LexicalModel model = new LexicalModel(resource.getFilename(), root.path("bias").asDouble(0.0), weights);
            log.info("event=model_loaded resource={} features={}", resource.getDescription(), weights.size());
            return Optional.of(model);
        } catch (IOException e) {
            log.warn("event=model_unreadable resource={} reason={}", resource.getDescription(), e.getMessage());
            return Optional.empty();
        }
    }

    public String name() {
        return name;
    }

    public double score(String text) {
        double z = bias;
        for (String feature : features(text)) {
            z += weights.getOrDefault(feature, 0.0);
        }
        return 1.0 / (1.0 + Math.exp(-z));
    }

    static Set<String> features(String text) {
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+");
        Set<String> out = new LinkedHashSet<>();
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            out.add(token);
            if (previous != null) {
                out.add(previous + " " + token);
            }
            previous = token;
        }
        return out;
    }
}

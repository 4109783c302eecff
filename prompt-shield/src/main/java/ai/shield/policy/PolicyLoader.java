package ai.shield.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class PolicyLoader {
    static final List<DetectorKind> DEFAULT_ORDER = List.of(DetectorKind.PROMPT_INJECTION, DetectorKind.HARMFUL_CONTENT);
    private static final double DEFAULT_THRESHOLD = 0.5;

    private final ObjectMapper objectMapper;

    public PolicyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Policy load(Resource source) {
        if (source == null || !source.exists()) {
            throw new ConfigException("policy source not found: " + (source == null ? "null" : source.getDescription()));
        }
        try (InputStream in = source.getInputStream()) {
            return parse(objectMapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new ConfigException("policy is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("policy source unreadable: " + source.getDescription(), e);
        }
    }

    public Policy parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException("policy is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    Policy parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("policy root must be an object");
        }

        String model = root.path("backend").path("model").asText("").trim();
        if (model.isEmpty()) {
            throw new ConfigException("backend.model is required");
        }

        JsonNode detectorsNode = root.get("enabled_detectors");
        if (detectorsNode == null || !detectorsNode.isObject()) {
            throw new ConfigException("enabled_detectors is required");
        }
        Map<DetectorKind, DetectorPolicy> detectors = parseDetectors(detectorsNode, "enabled_detectors");

        ResponseScreeningPolicy responseScreening = ResponseScreeningPolicy.off();
        JsonNode responseNode = root.get("response_screening");
        if (responseNode != null && !responseNode.isNull()) {
            if (!responseNode.isObject()) {
                throw new ConfigException("response_screening must be an object");
            }
            JsonNode responseDetectors = responseNode.get("detectors");
            responseScreening = new ResponseScreeningPolicy(
                    requireBoolean(responseNode, "enabled", "response_screening"),
                    responseDetectors == null
                            ? Map.of()
                            : parseDetectors(responseDetectors, "response_screening.detectors")
            );
        }

        JsonNode failNode = root.path("fail_policy");
        if (!failNode.isMissingNode() && !failNode.isNull() && !failNode.isObject()) {
            throw new ConfigException("fail_policy must be an object");
        }
        return new Policy(
                root.path("version").asText("unversioned"),
                model,
                parseOrder(root.get("detector_order")),
                detectors,
                responseScreening,
                parseFailMode(failNode, "detector_unavailable"),
                parseFailMode(failNode, "backend_unavailable")
        );
    }

    private Map<DetectorKind, DetectorPolicy> parseDetectors(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new ConfigException(path + " must be an object");
        }
        Map<DetectorKind, DetectorPolicy> out = new EnumMap<>(DetectorKind.class);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            DetectorKind kind = DetectorKind.fromKey(field.getKey())
                    .orElseThrow(() -> new ConfigException("unknown detector " + path + "." + field.getKey()));
            out.put(kind, parseDetector(kind, field.getValue(), path + "." + field.getKey()));
        }
        return out;
    }

    private DetectorPolicy parseDetector(DetectorKind kind, JsonNode node, String path) {
        if (!node.isObject()) {
            throw new ConfigException(path + " must be an object");
        }
        boolean enabled = requireBoolean(node, "enabled", path);

        JsonNode strategyNode = node.get("strategy");
        if (strategyNode == null || !strategyNode.isTextual()) {
            throw new ConfigException(path + ".strategy is required");
        }
        StrategyVariant strategy = StrategyVariant.fromKey(strategyNode.asText())
                .orElseThrow(() -> new ConfigException(
                        path + ".strategy must be one of ml, heuristic, llm, hybrid but was " + strategyNode.asText()));

        double threshold = DEFAULT_THRESHOLD;
        JsonNode thresholdNode = node.get("threshold");
        if (thresholdNode != null && !thresholdNode.isNull()) {
            if (!thresholdNode.isNumber()) {
                throw new ConfigException(path + ".threshold must be a number");
            }
            threshold = thresholdNode.asDouble();
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new ConfigException(path + ".threshold must be within [0,1] but was " + threshold);
            }
        }

        Set<String> entityTypes = new LinkedHashSet<>(readStrings(node.get("entity_types"), path + ".entity_types"));
        if (kind == DetectorKind.PII_REDACTION
                && enabled
                && strategy.redactionPasses().contains(StrategyVariant.MODEL_BASED)
                && entityTypes.isEmpty()) {
            throw new ConfigException(path + ".entity_types must not be empty for strategy " + strategy.key());
        }

        DetectorAction action = DetectorAction.BLOCK;
        JsonNode actionNode = node.get("action");
        if (actionNode != null && !actionNode.isNull()) {
            action = switch (actionNode.asText()) {
                case "block" -> DetectorAction.BLOCK;
                case "flag" -> DetectorAction.FLAG;
                default -> throw new ConfigException(path + ".action must be block or flag");
            };
        }

        return new DetectorPolicy(
                kind,
                enabled,
                strategy,
                threshold,
                entityTypes,
                readStrings(node.get("markers"), path + ".markers"),
                action
        );
    }

    private List<DetectorKind> parseOrder(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_ORDER;
        }
        if (!node.isArray()) {
            throw new ConfigException("detector_order must be an array");
        }
        List<DetectorKind> order = new ArrayList<>();
        for (JsonNode item : node) {
            DetectorKind kind = DetectorKind.fromKey(item.asText())
                    .orElseThrow(() -> new ConfigException("unknown detector in detector_order: " + item.asText()));
            if (!kind.isScreening()) {
                throw new ConfigException("detector_order may only list screening detectors, not " + kind.key());
            }
            if (order.contains(kind)) {
                throw new ConfigException("detector_order lists " + kind.key() + " twice");
            }
            order.add(kind);
        }
        return order;
    }

    private static FailMode parseFailMode(JsonNode failNode, String field) {
        JsonNode node = failNode.get(field);
        if (node == null || node.isNull()) {
            return FailMode.OPEN;
        }
        return switch (node.asText()) {
            case "open" -> FailMode.OPEN;
            case "closed" -> FailMode.CLOSED;
            default -> throw new ConfigException("fail_policy." + field + " must be open or closed");
        };
    }

    private static boolean requireBoolean(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new ConfigException(path + "." + field + " must be a boolean");
        }
        return value.asBoolean();
    }

    private static List<String> readStrings(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigException(path + " must be an array of strings");
        }
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

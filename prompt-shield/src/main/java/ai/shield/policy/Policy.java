package ai.shield.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Policy(
        String version,
        String backendModel,
        List<DetectorKind> detectorOrder,
        Map<DetectorKind, DetectorPolicy> detectors,
        ResponseScreeningPolicy responseScreening,
        FailMode detectorUnavailable,
        FailMode backendUnavailable
) {
    public Policy {
        detectorOrder = List.copyOf(detectorOrder);
        detectors = Map.copyOf(detectors);
        responseScreening = responseScreening == null ? ResponseScreeningPolicy.off() : responseScreening;
        detectorUnavailable = detectorUnavailable == null ? FailMode.OPEN : detectorUnavailable;
        backendUnavailable = backendUnavailable == null ? FailMode.OPEN : backendUnavailable;
    }

    public DetectorPolicy detector(DetectorKind kind) {
        return detectors.getOrDefault(kind, DetectorPolicy.disabled(kind));
    }

    public List<DetectorPolicy> screeningDetectors() {
        List<DetectorPolicy> out = new ArrayList<>();
        for (DetectorKind kind : detectorOrder) {
            DetectorPolicy detector = detector(kind);
            if (detector.enabled()) {
                out.add(detector);
            }
        }
        return out;
    }

    public DetectorPolicy responseDetector(DetectorKind kind) {
        DetectorPolicy override = responseScreening.detectors().get(kind);
        return override != null ? override : detector(kind);
    }

    public List<DetectorPolicy> responseScreeningDetectors() {
        List<DetectorPolicy> out = new ArrayList<>();
        for (DetectorKind kind : detectorOrder) {
            DetectorPolicy detector = responseDetector(kind);
            if (detector.enabled()) {
                out.add(detector);
            }
        }
        return out;
    }

    public Map<String, Object> describe() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version", version);
        view.put("backend_model", backendModel);
        view.put("detector_order", detectorOrder);
        view.put("enabled_detectors", describeDetectors(detectors));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("enabled", responseScreening.enabled());
        response.put("detectors", describeDetectors(responseScreening.detectors()));
        view.put("response_screening", response);

        Map<String, Object> fail = new LinkedHashMap<>();
        fail.put("detector_unavailable", detectorUnavailable);
        fail.put("backend_unavailable", backendUnavailable);
        view.put("fail_policy", fail);
        return view;
    }

    private static Map<String, Object> describeDetectors(Map<DetectorKind, DetectorPolicy> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (DetectorKind kind : DetectorKind.values()) {
            DetectorPolicy detector = source.get(kind);
            if (detector == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("enabled", detector.enabled());
            entry.put("strategy", detector.strategy());
            entry.put("threshold", detector.threshold());
            entry.put("action", detector.action());
            entry.put("entity_types", detector.entityTypes().stream().sorted().toList());
            if (!detector.markers().isEmpty()) {
                entry.put("markers", detector.markers());
            }
            out.put(kind.key(), entry);
        }
        return out;
    }
}

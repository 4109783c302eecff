package ai.shield.detect.model;

import ai.shield.detect.DetectionResult;
import ai.shield.detect.DetectorUnavailableException;
import ai.shield.detect.Span;
import ai.shield.policy.DetectorAction;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.StrategyVariant;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NamedEntityPiiDetectorTest {
    private final EntityGazetteer gazetteer = new EntityGazetteer(
            Map.of("LOCATION", List.of("Berlin", "New York"), "ORGANIZATION", List.of("Acme Corp")),
            List.of("Alice"));

    @Test
    void shouldMaskOnlyConfiguredLabels() {
        NamedEntityPiiDetector detector = new NamedEntityPiiDetector(Optional.of(gazetteer));

        DetectionResult result = detector.detect("Alice Smith moved to Berlin to join Acme Corp", policy(Set.of("PERSON", "GPE")));

        assertEquals(List.of("PERSON", "LOCATION"), result.spans().stream().map(Span::label).toList());
    }

    @Test
    void shouldRecognizeHonorificsAndDates() {
        List<Span> spans = gazetteer.recognize("Dr. Jane Doe saw me on March 3, 2024");

        assertEquals(List.of("PERSON", "DATE"), spans.stream().map(Span::label).toList());
    }

    @Test
    void shouldBeUnavailableWithoutGazetteer() {
        NamedEntityPiiDetector detector = new NamedEntityPiiDetector(Optional.empty());

        assertFalse(detector.isAvailable());
        assertThrows(DetectorUnavailableException.class, () -> detector.detect("Alice", policy(Set.of("PERSON"))));
    }

    private static DetectorPolicy policy(Set<String> entityTypes) {
        return new DetectorPolicy(DetectorKind.PII_REDACTION, true, StrategyVariant.MODEL_BASED, 0.5,
                entityTypes, List.of(), DetectorAction.BLOCK);
    }
}

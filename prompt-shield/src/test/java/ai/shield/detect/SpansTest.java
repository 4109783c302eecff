package ai.shield.detect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpansTest {
    @Test
    void shouldMergeOverlappingSpansIntoTheirUnion() {
        List<Span> merged = Spans.mergeOverlaps(List.of(
                new Span(12, 31, "EMAIL"),
                new Span(5, 19, "PHONE"),
                new Span(40, 45, "SSN")));

        assertEquals(List.of(new Span(5, 31, "PHONE"), new Span(40, 45, "SSN")), merged);
    }

    @Test
    void shouldLabelGroupAfterLongestSpanAtSameStart() {
        List<Span> merged = Spans.mergeOverlaps(List.of(
                new Span(0, 4, "PHONE"),
                new Span(0, 16, "CREDIT_CARD"),
                new Span(10, 20, "SSN")));

        assertEquals(List.of(new Span(0, 20, "CREDIT_CARD")), merged);
    }

    @Test
    void shouldKeepAdjacentSpansApartAndDropEmptyOnes() {
        List<Span> merged = Spans.mergeOverlaps(List.of(
                new Span(0, 5, "EMAIL"),
                new Span(5, 9, "PHONE"),
                new Span(7, 7, "PII")));

        assertEquals(List.of(new Span(0, 5, "EMAIL"), new Span(5, 9, "PHONE")), merged);
    }
}

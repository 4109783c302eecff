package ai.shield.detect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class Spans {
    private static final Comparator<Span> LEFTMOST_LONGEST = Comparator
            .comparingInt(Span::start)
            .thenComparing(Comparator.comparingInt(Span::length).reversed());

    private Spans() {}

    /**
     * Collapses every overlapping group into one span covering their union, labelled after the
     * leftmost, then longest, member. No character of any candidate is left outside the result.
     */
    public static List<Span> mergeOverlaps(List<Span> candidates) {
        List<Span> sorted = new ArrayList<>(candidates);
        sorted.sort(LEFTMOST_LONGEST);
        List<Span> out = new ArrayList<>();
        Span current = null;
        for (Span span : sorted) {
            if (span.length() == 0) {
                continue;
            }
            if (current != null && span.start() < current.end()) {
                if (span.end() > current.end()) {
                    current = new Span(current.start(), span.end(), current.label());
                }
                continue;
            }
            if (current != null) {
                out.add(current);
            }
            current = span;
        }
        if (current != null) {
            out.add(current);
        }
        return out;
    }
}

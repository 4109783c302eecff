package ai.shield.trace;

import ai.shield.detect.Decision;
import ai.shield.policy.StrategyVariant;

import java.util.ArrayList;
import java.util.List;

public class TraceRecorder {
    private final List<TraceStep> steps = new ArrayList<>();

    public synchronized TraceStep append(String stepName, StrategyVariant strategy, Decision decision, String reason) {
        TraceStep step = new TraceStep(steps.size() + 1, stepName, strategy, decision, reason);
        steps.add(step);
        return step;
    }

    public synchronized List<TraceStep> steps() {
        return List.copyOf(steps);
    }

    public synchronized int size() {
        return steps.size();
    }
}

package ai.shield.orchestrator;

import ai.shield.detect.Decision;
import ai.shield.detect.DetectionResult;
import ai.shield.detect.Detector;
import ai.shield.detect.StrategyRegistry;
import ai.shield.llm.RequestCancelledException;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.FailMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Component
public class DetectionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final StrategyRegistry registry;
    private final MeterRegistry meterRegistry;
    private final boolean parallel;
    private final ExecutorService executor;

    public DetectionOrchestrator(
            StrategyRegistry registry,
            MeterRegistry meterRegistry,
            @Value("${shield.detection.parallel:false}") boolean parallel,
            @Value("${shield.detection.pool-size:8}") int poolSize
    ) {
        this.registry = registry;
        this.meterRegistry = meterRegistry;
        this.parallel = parallel;
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    /**
     * @param stepPrefix prepended to each detector key to form the trace step name
     * @throws RequestCancelledException when the request is cancelled mid-round
     */
    public ScreeningOutcome screen(RequestContext context, String text, List<DetectorPolicy> detectors, String stepPrefix) {
        if (detectors.isEmpty()) {
            return ScreeningOutcome.allowed(List.of());
        }
        return parallel
                ? screenParallel(context, text, detectors, stepPrefix)
                : screenSequential(context, text, detectors, stepPrefix);
    }

    private ScreeningOutcome screenSequential(RequestContext context, String text, List<DetectorPolicy> detectors, String stepPrefix) {
        List<String> flagged = new ArrayList<>();
        for (DetectorPolicy detector : detectors) {
            context.cancellation().throwIfCancelled();
            Future<StepOutcome> future = executor.submit(() -> evaluate(context, text, detector, stepPrefix));
            context.cancellation().register(future);
            StepOutcome outcome;
            try {
                outcome = future.get();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new RequestCancelledException("detection interrupted");
            } catch (CancellationException e) {
                throw new RequestCancelledException("detection cancelled");
            } catch (ExecutionException e) {
                throw unwrap(e);
            } finally {
                context.cancellation().unregister(future);
            }

            ScreeningOutcome done = record(context, outcome, flagged);
            if (done != null) {
                return done;
            }
        }
        return ScreeningOutcome.allowed(flagged);
    }

    private ScreeningOutcome screenParallel(RequestContext context, String text, List<DetectorPolicy> detectors, String stepPrefix) {
        context.cancellation().throwIfCancelled();
        CompletionService<StepOutcome> completion = new ExecutorCompletionService<>(executor);
        List<Future<StepOutcome>> futures = new ArrayList<>();
        for (DetectorPolicy detector : detectors) {
            Future<StepOutcome> future = completion.submit(() -> evaluate(context, text, detector, stepPrefix));
            futures.add(future);
            context.cancellation().register(future);
        }

        List<String> flagged = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                StepOutcome outcome;
                try {
                    outcome = completion.take().get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RequestCancelledException("detection interrupted");
                } catch (CancellationException e) {
                    throw new RequestCancelledException("detection cancelled");
                } catch (ExecutionException e) {
                    throw unwrap(e);
                }
                ScreeningOutcome done = record(context, outcome, flagged);
                if (done != null) {
                    return done;
                }
            }
            return ScreeningOutcome.allowed(flagged);
        } finally {
            for (Future<StepOutcome> future : futures) {
                future.cancel(true);
                context.cancellation().unregister(future);
            }
        }
    }

    /** Appends the step; returns the final outcome when it blocks. */
    private ScreeningOutcome record(RequestContext context, StepOutcome outcome, List<String> flagged) {
        context.trace().append(outcome.step(), outcome.policy().strategy(), outcome.decision(), outcome.reason());
        Counter.builder("shield_detector_decisions_total")
                .tag("step", outcome.step())
                .tag("decision", outcome.decision().key())
                .register(meterRegistry)
                .increment();

        if (outcome.decision() == Decision.FLAG) {
            flagged.add(outcome.step());
            log.info("event=detector_flagged request_id={} step={} reason={}",
                    context.requestId(), outcome.step(), outcome.reason());
        }
        if (outcome.decision() == Decision.BLOCK) {
            return ScreeningOutcome.blocked(outcome.step(), outcome.reason(), flagged);
        }
        return null;
    }

    private StepOutcome evaluate(RequestContext context, String text, DetectorPolicy policy, String stepPrefix) {
        String step = stepPrefix + policy.kind().key();
        FailMode failMode = context.policy().detectorUnavailable();
        try {
            Detector detector = registry.resolve(policy.kind(), policy.strategy());
            if (!detector.isAvailable()) {
                return unavailable(context, step, policy, failMode, "capability missing");
            }
            DetectionResult result = detector.detect(text, policy);
            return new StepOutcome(step, policy, result.decision(), result.reason());
        } catch (RequestCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RequestCancelledException("detector " + step + " interrupted");
            }
            return unavailable(context, step, policy, failMode, e.getMessage());
        }
    }

    private StepOutcome unavailable(RequestContext context, String step, DetectorPolicy policy, FailMode failMode, String cause) {
        String reason = failMode.reasonFor(policy.kind().key());
        log.warn("event=detector_unavailable request_id={} step={} strategy={} fail_mode={} cause={}",
                context.requestId(), step, policy.strategy().key(), failMode.key(), cause);
        Decision decision = failMode == FailMode.CLOSED ? Decision.BLOCK : Decision.ALLOW;
        return new StepOutcome(step, policy, decision, reason);
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("detector failed", cause);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private record StepOutcome(String step, DetectorPolicy policy, Decision decision, String reason) {}
}

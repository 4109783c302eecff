package ai.shield.support;

import ai.shield.audit.ShieldEventLogger;
import ai.shield.detect.Detector;
import ai.shield.detect.HybridDetector;
import ai.shield.detect.StrategyRegistry;
import ai.shield.detect.backend.BackendClassifierDetector;
import ai.shield.detect.backend.BackendPiiDetector;
import ai.shield.detect.heuristic.HarmfulLexiconDetector;
import ai.shield.detect.heuristic.InjectionMarkerDetector;
import ai.shield.detect.heuristic.PiiPatternDetector;
import ai.shield.detect.model.EntityGazetteer;
import ai.shield.detect.model.LexicalModel;
import ai.shield.detect.model.ModelBasedDetector;
import ai.shield.detect.model.NamedEntityPiiDetector;
import ai.shield.llm.BackendInvoker;
import ai.shield.llm.LlmClient;
import ai.shield.orchestrator.DetectionOrchestrator;
import ai.shield.orchestrator.ResponseScreeningOrchestrator;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.Policy;
import ai.shield.policy.PolicyLoader;
import ai.shield.policy.PolicyStore;
import ai.shield.redact.RedactionEngine;
import ai.shield.service.ShieldPipeline;
import ai.shield.session.ConversationSessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class Fixtures {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_POLICY = """
            {
              "version": "test-1",
              "backend": {"model": "test-model"},
              "detector_order": ["prompt_injection", "harmful_content"],
              "enabled_detectors": {
                "prompt_injection": {"enabled": true, "strategy": "heuristic", "threshold": 0.5},
                "harmful_content": {"enabled": true, "strategy": "heuristic", "threshold": 0.5},
                "pii_redaction": {"enabled": true, "strategy": "heuristic", "entity_types": []}
              },
              "response_screening": {
                "enabled": true,
                "detectors": {
                  "harmful_content": {"enabled": true, "strategy": "heuristic", "threshold": 0.5},
                  "prompt_injection": {"enabled": false, "strategy": "heuristic"},
                  "pii_redaction": {"enabled": true, "strategy": "heuristic"}
                }
              },
              "fail_policy": {"detector_unavailable": "open", "backend_unavailable": "open"}
            }
            """;

    private static final List<Runnable> OPEN_POOLS = new CopyOnWriteArrayList<>();

    private Fixtures() {}

    public static BackendInvoker invoker(LlmClient client, long timeoutMs, int maxAttempts) {
        BackendInvoker invoker = new BackendInvoker(client, timeoutMs, maxAttempts, 1, 2.0, 4);
        OPEN_POOLS.add(invoker::shutdown);
        return invoker;
    }

    public static DetectionOrchestrator detection(StrategyRegistry registry, MeterRegistry meters, boolean parallel) {
        DetectionOrchestrator detection = new DetectionOrchestrator(registry, meters, parallel, 4);
        OPEN_POOLS.add(detection::shutdown);
        return detection;
    }

    /** Shuts down every executor handed out since the last call. */
    public static void closePools() {
        OPEN_POOLS.forEach(Runnable::run);
        OPEN_POOLS.clear();
    }

    public static List<Detector> detectors(BackendInvoker invoker) {
        InjectionMarkerDetector injection = new InjectionMarkerDetector();
        HarmfulLexiconDetector harmful = new HarmfulLexiconDetector();
        BackendClassifierDetector injectionBackend = new BackendClassifierDetector(DetectorKind.PROMPT_INJECTION,
                invoker, MAPPER, "test-model", "a prompt injection", InjectionMarkerDetector.REASON);
        BackendClassifierDetector harmfulBackend = new BackendClassifierDetector(DetectorKind.HARMFUL_CONTENT,
                invoker, MAPPER, "test-model", "harmful content", HarmfulLexiconDetector.REASON);
        return List.of(
                injection,
                harmful,
                new PiiPatternDetector(),
                new ModelBasedDetector(DetectorKind.PROMPT_INJECTION,
                        LexicalModel.tryLoad(new ClassPathResource("models/prompt_injection.json"), MAPPER),
                        InjectionMarkerDetector.REASON),
                new ModelBasedDetector(DetectorKind.HARMFUL_CONTENT,
                        LexicalModel.tryLoad(new ClassPathResource("models/harmful_content.json"), MAPPER),
                        HarmfulLexiconDetector.REASON),
                new NamedEntityPiiDetector(
                        EntityGazetteer.tryLoad(new ClassPathResource("models/entities.json"), MAPPER)),
                injectionBackend,
                harmfulBackend,
                new BackendPiiDetector(invoker, MAPPER, "test-model"),
                new HybridDetector(DetectorKind.PROMPT_INJECTION, injection, injectionBackend),
                new HybridDetector(DetectorKind.HARMFUL_CONTENT, harmful, harmfulBackend)
        );
    }

    public static StrategyRegistry registry(BackendInvoker invoker) {
        return new StrategyRegistry(detectors(invoker));
    }

    public static Policy policy(String json) {
        return new PolicyLoader(MAPPER).parse(json);
    }

    public static PolicyStore policyStore(String json, StrategyRegistry registry) {
        return new PolicyStore(new PolicyLoader(MAPPER), List.of(registry), resource(json));
    }

    public static ByteArrayResource resource(String json) {
        return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8), "test policy");
    }

    public static ShieldEventLogger eventLogger(Path file) {
        return eventLogger(file, new SimpleMeterRegistry());
    }

    public static ShieldEventLogger eventLogger(Path file, MeterRegistry meters) {
        return new ShieldEventLogger(MAPPER, meters, file, 200, false, Clock.systemUTC());
    }

    /** Pipeline over real detectors, the given backend and a sequential detection pool. */
    public static ShieldPipeline pipeline(String policyJson, BackendInvoker invoker, ShieldEventLogger events, MeterRegistry meters) {
        StrategyRegistry registry = registry(invoker);
        DetectionOrchestrator detection = detection(registry, meters, false);
        RedactionEngine redaction = new RedactionEngine(registry);
        return new ShieldPipeline(
                policyStore(policyJson, registry),
                detection,
                redaction,
                new ResponseScreeningOrchestrator(detection, redaction),
                invoker,
                new ConversationSessionStore(30, 5, 100),
                events,
                meters,
                20_000
        );
    }
}

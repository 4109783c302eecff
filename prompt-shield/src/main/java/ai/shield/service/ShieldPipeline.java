package ai.shield.service;

import ai.shield.audit.EventType;
import ai.shield.audit.ShieldEventLogger;
import ai.shield.detect.Decision;
import ai.shield.llm.BackendInvoker;
import ai.shield.llm.ExternalServiceException;
import ai.shield.llm.LlmRequest;
import ai.shield.llm.RequestCancelledException;
import ai.shield.orchestrator.DetectionOrchestrator;
import ai.shield.orchestrator.PipelineState;
import ai.shield.orchestrator.RequestContext;
import ai.shield.orchestrator.ResponseScreening;
import ai.shield.orchestrator.ResponseScreeningOrchestrator;
import ai.shield.orchestrator.ScreeningOutcome;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.FailMode;
import ai.shield.policy.Policy;
import ai.shield.policy.PolicyStore;
import ai.shield.policy.StrategyVariant;
import ai.shield.redact.RedactionEngine;
import ai.shield.redact.RedactionResult;
import ai.shield.session.ConversationSession;
import ai.shield.session.ConversationSessionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
public class ShieldPipeline {
    private static final Logger log = LoggerFactory.getLogger(ShieldPipeline.class);

    static final String BACKEND_UNAVAILABLE_MESSAGE =
            "The language model is currently unavailable. Your prompt passed all safety checks; please try again later.";
    static final String LLM_STEP = "llm_generation";

    private final PolicyStore policyStore;
    private final DetectionOrchestrator detection;
    private final RedactionEngine redaction;
    private final ResponseScreeningOrchestrator responseScreening;
    private final BackendInvoker backend;
    private final ConversationSessionStore sessions;
    private final ShieldEventLogger events;
    private final MeterRegistry meterRegistry;
    private final int maxPromptChars;

    public ShieldPipeline(
            PolicyStore policyStore,
            DetectionOrchestrator detection,
            RedactionEngine redaction,
            ResponseScreeningOrchestrator responseScreening,
            BackendInvoker backend,
            ConversationSessionStore sessions,
            ShieldEventLogger events,
            MeterRegistry meterRegistry,
            @Value("${shield.request.max-prompt-chars:20000}") int maxPromptChars
    ) {
        this.policyStore = policyStore;
        this.detection = detection;
        this.redaction = redaction;
        this.responseScreening = responseScreening;
        this.backend = backend;
        this.sessions = sessions;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.maxPromptChars = maxPromptChars;
    }

    /**
     * @throws ValidationException       when the prompt is missing, blank or too long
     * @throws RequestCancelledException when the request was cancelled before it concluded
     */
    public ShieldOutcome shield(String requestId, String prompt, String sessionId) {
        return run(open(requestId, prompt, sessionId), sessionId);
    }

    /**
     * Validates the request and binds it to the current policy snapshot without running it.
     *
     * @throws ValidationException when the prompt is missing, blank or too long
     */
    public RequestContext open(String requestId, String prompt, String sessionId) {
        validate(prompt, sessionId);
        return new RequestContext(requestId, prompt, policyStore.current());
    }

    public ShieldOutcome run(RequestContext context, String sessionId) {
        long startNs = System.nanoTime();
        String outcomeTag = "error";
        try {
            ShieldOutcome outcome = process(context, sessionId);
            outcomeTag = outcome.status().key();
            return outcome;
        } catch (RequestCancelledException e) {
            outcomeTag = "cancelled";
            context.markCancelled();
            log.info("event=shield_request_cancelled request_id={} state={}", context.requestId(), context.state());
            throw e;
        } finally {
            Counter.builder("shield_requests_total")
                    .tag("outcome", outcomeTag)
                    .register(meterRegistry)
                    .increment();
            Timer.builder("shield_request_latency")
                    .publishPercentileHistogram()
                    .register(meterRegistry)
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    private ShieldOutcome process(RequestContext context, String sessionId) {
        Policy policy = context.policy();
        String prompt = context.originalPrompt();

        context.moveTo(PipelineState.INPUT_SCREENING);
        ScreeningOutcome screening = detection.screen(context, prompt, policy.screeningDetectors(), "");
        if (screening.isBlocked()) {
            context.moveTo(PipelineState.BLOCKED_INPUT);
            logEvent(context, EventType.BLOCK, prompt, metadata(context, screening.step(), "blocked", screening.reason(), "input"));
            return ShieldOutcome.blocked(context.requestId(), screening.reason(), prompt, context.trace().steps());
        }

        context.moveTo(PipelineState.REDACTING);
        String processed = redactPrompt(context, prompt);
        context.processedPrompt(processed);

        context.moveTo(PipelineState.BACKEND_INVOCATION);
        ConversationSession session = sessionId == null ? null : sessions.open(sessionId);
        String generated;
        boolean fallback = false;
        try {
            generated = generate(context, session, processed);
            context.trace().append(LLM_STEP, StrategyVariant.BACKEND_ASSISTED, Decision.ALLOW, null);
        } catch (ExternalServiceException e) {
            FailMode failMode = policy.backendUnavailable();
            String reason = failMode.reasonFor("backend");
            Counter.builder("shield_backend_fallback_total")
                    .tag("reason", reason)
                    .register(meterRegistry)
                    .increment();
            log.warn("event=backend_unavailable request_id={} fail_mode={} cause={}",
                    context.requestId(), failMode.key(), e.getMessage());
            if (failMode == FailMode.CLOSED) {
                context.trace().append(LLM_STEP, StrategyVariant.BACKEND_ASSISTED, Decision.BLOCK, reason);
                context.moveTo(PipelineState.BLOCKED_OUTPUT);
                logEvent(context, EventType.BLOCK, processed, metadata(context, LLM_STEP, "blocked_response", reason, "backend"));
                return ShieldOutcome.blockedResponse(context.requestId(), reason, prompt, context.trace().steps());
            }
            context.trace().append(LLM_STEP, StrategyVariant.BACKEND_ASSISTED, Decision.ALLOW, reason);
            generated = BACKEND_UNAVAILABLE_MESSAGE;
            fallback = true;
        }
        context.backendResponse(generated);

        context.moveTo(PipelineState.OUTPUT_SCREENING);
        String finalResponse = generated;
        if (!fallback) {
            ResponseScreening screened = responseScreening.screen(context, generated);
            if (screened.isBlocked()) {
                context.moveTo(PipelineState.BLOCKED_OUTPUT);
                logEvent(context, EventType.BLOCK, processed, metadata(context, screened.outcome().step(),
                        "blocked_response", screened.outcome().reason(), "output"));
                return ShieldOutcome.blockedResponse(context.requestId(), screened.outcome().reason(), prompt,
                        context.trace().steps());
            }
            finalResponse = screened.text();
            if (screened.isRedacted()) {
                Map<String, String> meta = metadata(context, ResponseScreeningOrchestrator.STEP_PREFIX
                        + DetectorKind.PII_REDACTION.key(), "redacted_response", null, "output");
                meta.put("entities", screened.redaction().labelSummary());
                logEvent(context, EventType.REDACT, finalResponse, meta);
            }
            if (session != null) {
                session.append(processed, finalResponse);
            }
        }

        context.moveTo(PipelineState.COMPLETED);
        Map<String, String> meta = metadata(context, null, "success", null, "output");
        if (fallback) {
            meta.put("backend", "unavailable");
        }
        logEvent(context, EventType.SUCCESS, processed, meta);
        return ShieldOutcome.success(context.requestId(), prompt, processed, finalResponse, context.trace().steps());
    }

    private String redactPrompt(RequestContext context, String prompt) {
        DetectorPolicy pii = context.policy().detector(DetectorKind.PII_REDACTION);
        if (!pii.enabled()) {
            return prompt;
        }
        RedactionResult result = redaction.redact(prompt, pii);
        context.trace().append(DetectorKind.PII_REDACTION.key(), pii.strategy(),
                result.redacted() ? Decision.REDACTED : Decision.ALLOW, result.traceReason());
        if (result.redacted()) {
            Map<String, String> meta = metadata(context, DetectorKind.PII_REDACTION.key(), "redacted", null, "input");
            meta.put("entities", result.labelSummary());
            logEvent(context, EventType.REDACT, result.redactedText(), meta);
        }
        return result.redactedText();
    }

    // Previews are durable; they only ever carry locally redacted text.
    private void logEvent(RequestContext context, EventType type, String text, Map<String, String> metadata) {
        DetectorPolicy pii = context.policy().detector(DetectorKind.PII_REDACTION);
        events.record(type, redaction.redactLocally(text, pii), metadata);
    }

    private String generate(RequestContext context, ConversationSession session, String processed) {
        if (!backend.isAvailable()) {
            throw new ExternalServiceException("generation backend not configured");
        }
        String preamble = session == null ? null : session.preamble();
        LlmRequest request = new LlmRequest(context.policy().backendModel(), preamble, processed);
        return backend.invoke(request, context.cancellation()).text();
    }

    private void validate(String prompt, String sessionId) {
        if (prompt == null) {
            throw new ValidationException("Please provide a 'prompt' in the request body.");
        }
        if (prompt.isBlank()) {
            throw new ValidationException("'prompt' must not be blank.");
        }
        if (prompt.length() > maxPromptChars) {
            throw new ValidationException("'prompt' exceeds " + maxPromptChars + " characters.");
        }
        if (sessionId != null && sessionId.isBlank()) {
            throw new ValidationException("'session_id' must not be blank when present.");
        }
    }

    private static Map<String, String> metadata(RequestContext context, String detector, String status, String reason, String stage) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("request_id", context.requestId());
        meta.put("policy_version", context.policy().version());
        meta.put("stage", stage);
        meta.put("status", status);
        if (detector != null) {
            meta.put("detector", detector);
        }
        if (reason != null) {
            meta.put("reason", reason);
        }
        return meta;
    }
}

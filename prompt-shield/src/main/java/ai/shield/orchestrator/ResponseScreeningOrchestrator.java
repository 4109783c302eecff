package ai.shield.orchestrator;

import ai.shield.detect.Decision;
import ai.shield.policy.DetectorKind;
import ai.shield.policy.DetectorPolicy;
import ai.shield.policy.Policy;
import ai.shield.redact.RedactionEngine;
import ai.shield.redact.RedactionResult;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ResponseScreeningOrchestrator {
    public static final String STEP_PREFIX = "response_";

    private final DetectionOrchestrator detection;
    private final RedactionEngine redaction;

    public ResponseScreeningOrchestrator(DetectionOrchestrator detection, RedactionEngine redaction) {
        this.detection = detection;
        this.redaction = redaction;
    }

    public ResponseScreening screen(RequestContext context, String generated) {
        Policy policy = context.policy();
        if (!policy.responseScreening().enabled()) {
            return new ResponseScreening(ScreeningOutcome.allowed(List.of()), generated, null);
        }

        ScreeningOutcome outcome = detection.screen(context, generated, policy.responseScreeningDetectors(), STEP_PREFIX);
        if (outcome.isBlocked()) {
            return new ResponseScreening(outcome, null, null);
        }

        DetectorPolicy pii = policy.responseDetector(DetectorKind.PII_REDACTION);
        if (!pii.enabled()) {
            return new ResponseScreening(outcome, generated, null);
        }
        RedactionResult result = redaction.redact(generated, pii);
        context.trace().append(STEP_PREFIX + DetectorKind.PII_REDACTION.key(), pii.strategy(),
                result.redacted() ? Decision.REDACTED : Decision.ALLOW, result.traceReason());
        return new ResponseScreening(outcome, result.redactedText(), result);
    }
}

package ai.shield.orchestrator;

import ai.shield.detect.Decision;
import ai.shield.llm.CancellationToken;
import ai.shield.policy.Policy;
import ai.shield.trace.TraceRecorder;

/**
 * Per-request working state. The pipeline owns the state machine; each stage writes only its own
 * slot. The policy snapshot is fixed for the lifetime of the request.
 */
public class RequestContext {
    private final String requestId;
    private final String originalPrompt;
    private final Policy policy;
    private final TraceRecorder trace = new TraceRecorder();
    private final CancellationToken cancellation = new CancellationToken();

    private PipelineState state = PipelineState.RECEIVED;
    private String processedPrompt;
    private String backendResponse;
    private Decision terminalDecision;

    public RequestContext(String requestId, String originalPrompt, Policy policy) {
        this.requestId = requestId;
        this.originalPrompt = originalPrompt;
        this.policy = policy;
    }

    /**
     * @throws IllegalStateException when {@code next} is not a legal successor of the current state
     */
    public synchronized void moveTo(PipelineState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("illegal pipeline transition " + state + " -> " + next);
        }
        state = next;
        switch (next) {
            case BLOCKED_INPUT, BLOCKED_OUTPUT -> terminalDecision = Decision.BLOCK;
            case COMPLETED -> terminalDecision = Decision.ALLOW;
            default -> {
            }
        }
    }

    /** Cancels outstanding detector and backend work of this request only. */
    public void cancel() {
        cancellation.cancel();
    }

    public synchronized void markCancelled() {
        if (!state.isTerminal()) {
            state = PipelineState.CANCELLED;
        }
    }

    public String requestId() {
        return requestId;
    }

    public String originalPrompt() {
        return originalPrompt;
    }

    public Policy policy() {
        return policy;
    }

    public TraceRecorder trace() {
        return trace;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public synchronized PipelineState state() {
        return state;
    }

    public synchronized Decision terminalDecision() {
        return terminalDecision;
    }

    public synchronized String processedPrompt() {
        return processedPrompt;
    }

    public synchronized void processedPrompt(String processedPrompt) {
        this.processedPrompt = processedPrompt;
    }

    public synchronized String backendResponse() {
        return backendResponse;
    }

    public synchronized void backendResponse(String backendResponse) {
        this.backendResponse = backendResponse;
    }
}

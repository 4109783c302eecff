package ai.shield.api;

import ai.shield.api.model.ShieldPromptRequest;
import ai.shield.api.model.ShieldPromptResponse;
import ai.shield.llm.RequestCancelledException;
import ai.shield.orchestrator.RequestContext;
import ai.shield.service.ShieldOutcome;
import ai.shield.service.ShieldPipeline;
import ai.shield.session.ConversationSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.WebAsyncTask;

import java.util.UUID;

@RestController
public class ShieldController {
    private static final Logger log = LoggerFactory.getLogger(ShieldController.class);

    private final ShieldPipeline pipeline;
    private final ConversationSessionStore sessions;
    private final long requestTimeoutMs;

    public ShieldController(
            ShieldPipeline pipeline,
            ConversationSessionStore sessions,
            @Value("${shield.request.timeout-ms:60000}") long requestTimeoutMs
    ) {
        this.pipeline = pipeline;
        this.sessions = sessions;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Runs the pipeline off the servlet thread. A client disconnect, a servlet error or the request
     * timeout cancels the request's outstanding detector and backend work.
     */
    @PostMapping("/shield_prompt")
    public WebAsyncTask<ResponseEntity<ShieldPromptResponse>> shield(@RequestBody ShieldPromptRequest request) {
        String requestId = "ps_" + UUID.randomUUID().toString().replace("-", "");
        RequestContext context = pipeline.open(requestId, request.promptText(), request.sessionId());

        WebAsyncTask<ResponseEntity<ShieldPromptResponse>> task = new WebAsyncTask<>(requestTimeoutMs, () -> {
            ShieldOutcome outcome = pipeline.run(context, request.sessionId());
            HttpStatus status = outcome.isBlocked() ? HttpStatus.FORBIDDEN : HttpStatus.OK;
            return ResponseEntity.status(status).body(ShieldPromptResponse.from(outcome));
        });
        task.onTimeout(() -> {
            log.warn("event=shield_request_timeout request_id={} timeout_ms={}", requestId, requestTimeoutMs);
            context.cancel();
            throw new RequestCancelledException("request timed out after " + requestTimeoutMs + " ms");
        });
        task.onError(() -> {
            log.info("event=shield_request_aborted request_id={}", requestId);
            context.cancel();
            throw new RequestCancelledException("client connection closed");
        });
        task.onCompletion(context::cancel);
        return task;
    }

    @DeleteMapping("/api/sessions/{id}")
    public ResponseEntity<Void> resetSession(@PathVariable("id") String id) {
        sessions.reset(id);
        return ResponseEntity.noContent().build();
    }
}

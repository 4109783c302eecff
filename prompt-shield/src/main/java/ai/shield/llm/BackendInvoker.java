package ai.shield.llm;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class BackendInvoker {
    private static final Logger log = LoggerFactory.getLogger(BackendInvoker.class);

    private final LlmClient llmClient;
    private final long timeoutMs;
    private final int maxAttempts;
    private final Retry retry;
    private final ExecutorService executor;

    public BackendInvoker(
            LlmClient llmClient,
            @Value("${shield.backend.timeout-ms:8000}") long timeoutMs,
            @Value("${shield.backend.retry.max-attempts:2}") int maxAttempts,
            @Value("${shield.backend.retry.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${shield.backend.retry.multiplier:2.0}") double multiplier,
            @Value("${shield.backend.pool-size:16}") int poolSize
    ) {
        this.llmClient = llmClient;
        this.timeoutMs = timeoutMs;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
        this.retry = Retry.of("backend", RetryConfig.custom()
                .maxAttempts(this.maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1, initialBackoffMs), multiplier))
                .retryExceptions(ExternalServiceException.class)
                .ignoreExceptions(RequestCancelledException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "event=backend_retry attempt={} max_attempts={} reason={}",
                event.getNumberOfRetryAttempts(),
                this.maxAttempts,
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
    }

    public boolean isAvailable() {
        return llmClient.isAvailable();
    }

    public LlmCompletion invoke(LlmRequest request) {
        return invoke(request, new CancellationToken());
    }

    /**
     * @throws ExternalServiceException once all attempts failed or timed out
     * @throws RequestCancelledException when {@code token} was cancelled
     */
    public LlmCompletion invoke(LlmRequest request, CancellationToken token) {
        try {
            return retry.executeCallable(() -> attempt(request, token));
        } catch (ExternalServiceException | RequestCancelledException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalServiceException("backend call failed: " + e.getMessage(), e);
        }
    }

    private LlmCompletion attempt(LlmRequest request, CancellationToken token) {
        token.throwIfCancelled();
        Future<LlmCompletion> future = executor.submit(() -> llmClient.complete(request));
        token.register(future);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalServiceException("backend timed out after " + timeoutMs + " ms", e);
        } catch (CancellationException e) {
            throw new RequestCancelledException("backend call cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("backend call interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException external) {
                throw external;
            }
            if (cause instanceof RequestCancelledException cancelled) {
                throw cancelled;
            }
            throw new ExternalServiceException("backend call failed: " + cause, cause);
        } finally {
            token.unregister(future);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}

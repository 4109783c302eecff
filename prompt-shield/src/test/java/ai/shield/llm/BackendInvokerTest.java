package ai.shield.llm;

import ai.shield.support.Fixtures;
import ai.shield.support.ScriptedLlmClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackendInvokerTest {
    @AfterEach
    void closePools() {
        Fixtures.closePools();
    }

    @Test
    void shouldRetryTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();
        ScriptedLlmClient client = new ScriptedLlmClient(request -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ExternalServiceException("flaky");
            }
            return "ok";
        });
        BackendInvoker invoker = Fixtures.invoker(client, 1000, 3);

        assertEquals("ok", invoker.invoke(LlmRequest.of("m", "hi")).text());
        assertEquals(2, client.calls());
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        ScriptedLlmClient client = ScriptedLlmClient.failing();
        BackendInvoker invoker = Fixtures.invoker(client, 1000, 3);

        assertThrows(ExternalServiceException.class, () -> invoker.invoke(LlmRequest.of("m", "hi")));
        assertEquals(3, client.calls());
    }

    @Test
    void shouldTimeOutEachAttempt() {
        ScriptedLlmClient client = ScriptedLlmClient.hanging(5_000);
        BackendInvoker invoker = Fixtures.invoker(client, 100, 2);

        long start = System.nanoTime();
        ExternalServiceException e = assertThrows(ExternalServiceException.class,
                () -> invoker.invoke(LlmRequest.of("m", "hi")));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(e.getMessage().contains("timed out"));
        assertEquals(2, client.calls());
        assertTrue(elapsedMs < 3_000, "elapsed " + elapsedMs);
    }

    @Test
    void shouldStopWhenTokenCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        ScriptedLlmClient client = new ScriptedLlmClient(request -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RequestCancelledException("interrupted");
            }
            return "late";
        });
        BackendInvoker invoker = Fixtures.invoker(client, 20_000, 3);
        CancellationToken token = new CancellationToken();
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<LlmCompletion> pending = caller.submit(() -> invoker.invoke(LlmRequest.of("m", "hi"), token));
            assertTrue(started.await(2, TimeUnit.SECONDS));

            token.cancel();

            Exception e = assertThrows(Exception.class, () -> pending.get(2, TimeUnit.SECONDS));
            assertInstanceOf(RequestCancelledException.class, e.getCause());
            assertEquals(1, client.calls());
        } finally {
            caller.shutdownNow();
            }
    }

    @Test
    void shouldRejectWorkForAlreadyCancelledToken() {
        ScriptedLlmClient client = ScriptedLlmClient.replying("ok");
        BackendInvoker invoker = Fixtures.invoker(client, 1000, 2);
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(RequestCancelledException.class, () -> invoker.invoke(LlmRequest.of("m", "hi"), token));
        assertEquals(0, client.calls());
    }
}

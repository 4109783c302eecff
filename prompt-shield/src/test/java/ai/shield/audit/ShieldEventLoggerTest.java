package ai.shield.audit;

import ai.shield.support.Fixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ShieldEventLoggerTest {
    @TempDir
    Path dir;

    @Test
    void shouldReturnNewestEventsFirstUpToLimit() {
        ShieldEventLogger logger = Fixtures.eventLogger(dir.resolve("events.log"));
        for (int i = 1; i <= 5; i++) {
            logger.record(EventType.SUCCESS, "prompt " + i, Map.of("status", "success"));
        }

        List<ShieldEvent> events = logger.query(3);

        assertEquals(List.of("prompt 5", "prompt 4", "prompt 3"), events.stream().map(ShieldEvent::preview).toList());
    }

    @Test
    void shouldWriteSentinelLinesWithUtcTimestamp() throws Exception {
        Path file = dir.resolve("events.log");
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        ShieldEventLogger logger = new ShieldEventLogger(Fixtures.MAPPER, new SimpleMeterRegistry(), file, 200, true, clock);

        logger.record(EventType.BLOCK, "bad prompt", Map.of("detector", "prompt_injection", "reason", "prompt_injection_detected"));

        String line = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        assertTrue(line.startsWith(ShieldEventLogger.SENTINEL));
        assertTrue(line.contains("\"event_type\":\"BLOCK\""));
        assertTrue(line.contains("\"timestamp\":\"2024-05-01T10:15:30Z\""));

        ShieldEvent event = logger.query(1).get(0);
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), event.timestamp());
        assertEquals("prompt_injection", event.metadata().get("detector"));
    }

    @Test
    void shouldTruncatePreviewWithEllipsis() {
        ShieldEventLogger logger = new ShieldEventLogger(Fixtures.MAPPER, new SimpleMeterRegistry(),
                dir.resolve("events.log"), 10, false, Clock.systemUTC());

        ShieldEvent event = logger.record(EventType.SUCCESS, "abcdefghijklmnop", Map.of());

        assertEquals("abcdefghi…", event.preview());
        assertEquals(10, event.preview().length());
        assertEquals("short", ShieldEvent.preview("short", 10));
    }

    @Test
    void shouldSkipMalformedAndForeignLines() throws Exception {
        Path file = dir.resolve("events.log");
        ShieldEventLogger logger = Fixtures.eventLogger(file);
        logger.record(EventType.SUCCESS, "first", Map.of());
        Files.writeString(file, "plain application log line\nEVENT_JSON {broken\n", StandardOpenOption.APPEND);
        logger.record(EventType.REDACT, "second", Map.of());

        List<ShieldEvent> events = logger.query(10);

        assertEquals(List.of("second", "first"), events.stream().map(ShieldEvent::preview).toList());
    }

    @Test
    void shouldReturnEmptyWhenFileMissing() {
        assertTrue(Fixtures.eventLogger(dir.resolve("missing.log")).query(5).isEmpty());
    }

    @Test
    void shouldNotInterleaveConcurrentAppends() throws Exception {
        Path file = dir.resolve("events.log");
        ShieldEventLogger logger = Fixtures.eventLogger(file);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                futures.add(pool.submit(() -> logger.record(EventType.SUCCESS, "p" + n, Map.of("n", String.valueOf(n)))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(200, lines.size());
        assertTrue(lines.stream().allMatch(line -> line.startsWith(ShieldEventLogger.SENTINEL)));
        assertEquals(200, logger.query(500).size());
    }

    @Test
    void shouldReadTailOfLargeLog() {
        ShieldEventLogger logger = new ShieldEventLogger(Fixtures.MAPPER, new SimpleMeterRegistry(),
                dir.resolve("events.log"), 5_000, false, Clock.systemUTC());
        String filler = "x".repeat(2_000);
        for (int i = 1; i <= 100; i++) {
            logger.record(EventType.SUCCESS, i + " " + filler, Map.of("n", String.valueOf(i)));
        }

        List<ShieldEvent> newest = logger.query(3);
        assertEquals(List.of("100", "99", "98"), newest.stream().map(e -> e.metadata().get("n")).toList());

        List<ShieldEvent> all = logger.query(1_000);
        assertEquals(100, all.size());
        assertEquals("1", all.get(99).metadata().get("n"));
    }

    @Test
    void shouldFailAndCountWhenLogIsNotWritable() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ShieldEventLogger logger = new ShieldEventLogger(Fixtures.MAPPER, meters, dir, 200, false, Clock.systemUTC());

        assertThrows(EventLogUnavailableException.class,
                () -> logger.record(EventType.SUCCESS, "lost", Map.of("status", "success")));
        assertEquals(1.0, meters.get("shield_event_write_failures_total").counter().count());
    }
}

package ai.shield.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable, append-only store of {@link ShieldEvent}s. Each event is one line,
 * {@code EVENT_JSON <json>}, appended under an exclusive file lock and read back from the tail
 * under a shared one. Lines without the marker, or with a payload that does not parse, are
 * ignored on read.
 */
@Component
public class ShieldEventLogger {
    private static final Logger log = LoggerFactory.getLogger(ShieldEventLogger.class);
    static final String SENTINEL = "EVENT_JSON ";
    private static final int TAIL_CHUNK = 64 * 1024;

    private final ObjectMapper objectMapper;
    private final Path path;
    private final int previewLength;
    private final boolean fsync;
    private final Clock clock;
    private final Counter writeFailures;

    @Autowired
    public ShieldEventLogger(
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${shield.events.path:logs/prompt_shield_events.log}") String path,
            @Value("${shield.events.preview-length:200}") int previewLength,
            @Value("${shield.events.fsync:false}") boolean fsync
    ) {
        this(objectMapper, meterRegistry, Paths.get(path), previewLength, fsync, Clock.systemUTC());
    }

    public ShieldEventLogger(ObjectMapper objectMapper, MeterRegistry meterRegistry, Path path, int previewLength,
                             boolean fsync, Clock clock) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.path = path;
        this.previewLength = previewLength;
        this.fsync = fsync;
        this.clock = clock;
        this.writeFailures = Counter.builder("shield_event_write_failures_total")
                .register(meterRegistry);
    }

    public ShieldEvent record(EventType type, String previewSource, Map<String, String> metadata) {
        Map<String, String> clean = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                clean.put(key, value);
            }
        });
        ShieldEvent event = new ShieldEvent(type, clock.instant(), ShieldEvent.preview(previewSource, previewLength), clean);
        append(event);
        return event;
    }

    /**
     * @throws EventLogUnavailableException when the line could not be written; the event is lost
     */
    public synchronized void append(ShieldEvent event) {
        log.info("event=shield_{} timestamp={} metadata={}",
                event.eventType().name().toLowerCase(), event.timestamp(), event.metadata());
        try {
            String line = SENTINEL + objectMapper.writeValueAsString(event) + "\n";
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            try (FileChannel ch = FileChannel.open(path, EnumSet.of(
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND))) {
                try (FileLock lock = ch.lock()) {
                    ch.write(ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8)));
                    if (fsync) {
                        ch.force(true);
                    }
                }
            }
        } catch (IOException e) {
            writeFailures.increment();
            log.error("event=shield_event_persist_failed path={} reason={}", path, e.toString());
            throw new EventLogUnavailableException("event log not writable: " + path, e);
        }
    }

    /** Newest first, at most {@code limit} events. Reads backwards from the end of the file. */
    public synchronized List<ShieldEvent> query(int limit) {
        List<ShieldEvent> events = new ArrayList<>();
        if (limit <= 0) {
            return events;
        }
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.READ);
             FileLock lock = ch.lock(0L, Long.MAX_VALUE, true)) {
            long position = ch.size();
            byte[] carry = new byte[0];
            while (position > 0 && events.size() < limit) {
                int size = (int) Math.min(TAIL_CHUNK, position);
                position -= size;
                ByteBuffer buffer = ByteBuffer.allocate(size);
                int read = 0;
                while (read < size) {
                    int n = ch.read(buffer, position + read);
                    if (n < 0) {
                        break;
                    }
                    read += n;
                }
                byte[] block = new byte[size + carry.length];
                System.arraycopy(buffer.array(), 0, block, 0, size);
                System.arraycopy(carry, 0, block, size, carry.length);

                int end = block.length;
                for (int i = block.length - 1; i >= 0 && events.size() < limit; i--) {
                    if (block[i] == '\n') {
                        parseLine(new String(block, i + 1, end - i - 1, StandardCharsets.UTF_8), events);
                        end = i;
                    }
                }
                carry = Arrays.copyOf(block, end);
            }
            if (position == 0 && carry.length > 0 && events.size() < limit) {
                parseLine(new String(carry, StandardCharsets.UTF_8), events);
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new EventLogUnavailableException("event log unreadable: " + path, e);
        }
        return events;
    }

    private void parseLine(String line, List<ShieldEvent> out) {
        int idx = line.indexOf(SENTINEL);
        if (idx < 0) {
            return;
        }
        try {
            out.add(objectMapper.readValue(line.substring(idx + SENTINEL.length()).trim(), ShieldEvent.class));
        } catch (JsonProcessingException e) {
            log.debug("event=shield_event_skipped reason={}", e.getOriginalMessage());
        }
    }
}

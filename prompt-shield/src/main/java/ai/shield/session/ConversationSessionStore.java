package ai.shield.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class ConversationSessionStore {
    private static final Logger log = LoggerFactory.getLogger(ConversationSessionStore.class);

    private final Cache<String, ConversationSession> sessions;
    private final int maxTurns;

    @Autowired
    public ConversationSessionStore(
            @Value("${shield.session.ttl-minutes:30}") long ttlMinutes,
            @Value("${shield.session.max-turns:5}") int maxTurns,
            @Value("${shield.session.max-sessions:10000}") long maxSessions
    ) {
        this(Duration.ofMinutes(ttlMinutes), maxTurns, maxSessions, Ticker.systemTicker());
    }

    public ConversationSessionStore(Duration ttl, int maxTurns, long maxSessions, Ticker ticker) {
        this.maxTurns = maxTurns;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxSessions)
                .ticker(ticker)
                .build();
    }

    public ConversationSession open(String id) {
        return sessions.get(id, key -> {
            log.info("event=session_created session_id={}", key);
            return new ConversationSession(key, maxTurns);
        });
    }

    public Optional<ConversationSession> find(String id) {
        return Optional.ofNullable(sessions.getIfPresent(id));
    }

    /** @return whether a live session was dropped */
    public boolean reset(String id) {
        boolean present = sessions.asMap().remove(id) != null;
        log.info("event=session_reset session_id={} present={}", id, present);
        return present;
    }
}

package ai.shield.session;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ConversationSessionStoreTest {
    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    @Test
    void shouldCreateOnFirstUseAndReuseAfterwards() {
        ConversationSessionStore store = new ConversationSessionStore(Duration.ofMinutes(30), 3, 100, ticker);

        ConversationSession first = store.open("s1");
        first.append("hi", "hello");

        assertSame(first, store.open("s1"));
        assertEquals(1, store.find("s1").orElseThrow().turns().size());
    }

    @Test
    void shouldKeepOnlyRecentTurns() {
        ConversationSession session = new ConversationSession("s", 2);
        session.append("p1", "r1");
        session.append("p2", "r2");
        session.append("p3", "r3");

        assertEquals(2, session.turns().size());
        assertEquals("p2", session.turns().get(0).prompt());
        assertTrue(session.preamble().contains("User: p3"));
        assertFalse(session.preamble().contains("p1"));
    }

    @Test
    void shouldHaveNoPreambleForFreshSession() {
        assertNull(new ConversationSession("s", 2).preamble());
    }

    @Test
    void shouldDropSessionOnReset() {
        ConversationSessionStore store = new ConversationSessionStore(Duration.ofMinutes(30), 3, 100, ticker);
        store.open("s1").append("hi", "hello");

        assertTrue(store.reset("s1"));
        assertFalse(store.reset("s1"));
        assertTrue(store.find("s1").isEmpty());
        assertTrue(store.open("s1").turns().isEmpty());
    }

    @Test
    void shouldExpireIdleSessions() {
        ConversationSessionStore store = new ConversationSessionStore(Duration.ofMinutes(30), 3, 100, ticker);
        store.open("s1").append("hi", "hello");

        nanos.addAndGet(Duration.ofMinutes(31).toNanos());

        assertTrue(store.find("s1").isEmpty());
    }
}

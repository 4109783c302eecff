package ai.shield.session;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class ConversationSession {
    private final String id;
    private final int maxTurns;
    private final Deque<Turn> turns = new ArrayDeque<>();

    public ConversationSession(String id, int maxTurns) {
        this.id = id;
        this.maxTurns = Math.max(1, maxTurns);
    }

    public String id() {
        return id;
    }

    public synchronized void append(String prompt, String response) {
        turns.addLast(new Turn(prompt, response));
        while (turns.size() > maxTurns) {
            turns.removeFirst();
        }
    }

    public synchronized List<Turn> turns() {
        return List.copyOf(turns);
    }

    /** Context handed to the backend ahead of the new prompt; null for a fresh session. */
    public synchronized String preamble() {
        if (turns.isEmpty()) {
            return null;
        }
        StringBuilder out = new StringBuilder("Conversation so far (most recent last):\n");
        for (Turn turn : turns) {
            out.append("User: ").append(turn.prompt()).append('\n');
            out.append("Assistant: ").append(turn.response()).append('\n');
        }
        out.append("Answer the user's next message in this context.");
        return out.toString();
    }

    public record Turn(String prompt, String response) {}
}

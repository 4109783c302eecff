package ai.shield.audit;

public enum EventType {
    BLOCK,
    REDACT,
    SUCCESS
}

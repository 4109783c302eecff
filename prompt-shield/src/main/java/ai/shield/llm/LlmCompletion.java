package ai.shield.llm;

public record LlmCompletion(
        String provider,
        String model,
        String text
) {}

package ai.shield.llm;

public record LlmRequest(
        String model,
        String systemPrompt,
        String userPrompt
) {
    public static LlmRequest of(String model, String userPrompt) {
        return new LlmRequest(model, null, userPrompt);
    }
}

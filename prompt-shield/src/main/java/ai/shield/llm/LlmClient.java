package ai.shield.llm;

public interface LlmClient {
    /** False when the provider cannot be reached at all, e.g. no credential configured. */
    boolean isAvailable();

    /**
     * @throws ExternalServiceException on transport failure, non-2xx status or an empty reply
     */
    LlmCompletion complete(LlmRequest request);
}

package ai.shield.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "shield.llm", name = "provider", havingValue = "none", matchIfMissing = true)
public class NoopLlmClient implements LlmClient {
    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public LlmCompletion complete(LlmRequest request) {
        throw new ExternalServiceException("no generation provider configured");
    }
}

package ai.shield.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Component
@Primary
@ConditionalOnProperty(prefix = "shield.llm", name = "provider", havingValue = "openai")
public class OpenAiLlmClient implements LlmClient {
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String apiKey;
    private final String endpoint;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final long httpTimeoutMs;

    public OpenAiLlmClient(
            ObjectMapper objectMapper,
            @Value("${shield.llm.openai.api-key:}") String apiKey,
            @Value("${shield.llm.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
            @Value("${shield.llm.openai.model:gpt-4o-mini}") String model,
            @Value("${shield.llm.openai.temperature:0.2}") double temperature,
            @Value("${shield.llm.openai.max-tokens:1024}") int maxTokens,
            @Value("${shield.llm.openai.http-timeout-ms:10000}") long httpTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.endpoint = endpoint;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.httpTimeoutMs = httpTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .build();
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public LlmCompletion complete(LlmRequest request) {
        if (!isAvailable()) {
            throw new ExternalServiceException("openai api key missing");
        }

        String targetModel = request.model() == null || request.model().isBlank() ? model : request.model();
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildPayload(request, targetModel)))
                    .build();

            HttpResponse<String> response = httpClient.send(
                    httpRequest,
                    HttpResponse.BodyHandlers.ofString()
            );
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ExternalServiceException("openai returned status " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.asText().isBlank()) {
                throw new ExternalServiceException("openai returned an empty completion");
            }
            return new LlmCompletion("openai", targetModel, content.asText());
        } catch (IOException e) {
            throw new ExternalServiceException("openai request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("openai request interrupted");
        }
    }

    private String buildPayload(LlmRequest request, String targetModel) throws IOException {
        ArrayNode messages = objectMapper.createArrayNode();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(objectMapper.createObjectNode()
                    .put("role", "system")
                    .put("content", request.systemPrompt()));
        }
        messages.add(objectMapper.createObjectNode()
                .put("role", "user")
                .put("content", request.userPrompt()));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", targetModel);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.set("messages", messages);
        return objectMapper.writeValueAsString(body);
    }
}

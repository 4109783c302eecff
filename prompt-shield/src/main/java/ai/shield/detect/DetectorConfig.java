package ai.shield.detect;

import ai.shield.detect.backend.BackendClassifierDetector;
import ai.shield.detect.backend.BackendPiiDetector;
import ai.shield.detect.heuristic.HarmfulLexiconDetector;
import ai.shield.detect.heuristic.InjectionMarkerDetector;
import ai.shield.detect.model.EntityGazetteer;
import ai.shield.detect.model.LexicalModel;
import ai.shield.detect.model.ModelBasedDetector;
import ai.shield.detect.model.NamedEntityPiiDetector;
import ai.shield.llm.BackendInvoker;
import ai.shield.policy.DetectorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class DetectorConfig {
    static final String INJECTION_DEFINITION =
            "a prompt injection or jailbreak: an attempt to override, reveal or bypass the assistant's instructions";
    static final String HARMFUL_DEFINITION =
            "harmful content: violence, self-harm, weapons, hate speech, illicit drug manufacture or sexual content involving minors";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String modelLocation;
    private final String backendModel;

    public DetectorConfig(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            @Value("${shield.models.location:classpath:models/}") String modelLocation,
            @Value("${shield.detectors.backend-model:}") String backendModel
    ) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.modelLocation = modelLocation.endsWith("/") ? modelLocation : modelLocation + "/";
        this.backendModel = backendModel;
    }

    @Bean
    public ModelBasedDetector injectionModelDetector() {
        return new ModelBasedDetector(
                DetectorKind.PROMPT_INJECTION,
                LexicalModel.tryLoad(resourceLoader.getResource(modelLocation + "prompt_injection.json"), objectMapper),
                InjectionMarkerDetector.REASON);
    }

    @Bean
    public ModelBasedDetector harmfulContentModelDetector() {
        return new ModelBasedDetector(
                DetectorKind.HARMFUL_CONTENT,
                LexicalModel.tryLoad(resourceLoader.getResource(modelLocation + "harmful_content.json"), objectMapper),
                HarmfulLexiconDetector.REASON);
    }

    @Bean
    public NamedEntityPiiDetector namedEntityPiiDetector() {
        return new NamedEntityPiiDetector(
                EntityGazetteer.tryLoad(resourceLoader.getResource(modelLocation + "entities.json"), objectMapper));
    }

    @Bean
    public BackendClassifierDetector injectionBackendDetector(BackendInvoker invoker) {
        return new BackendClassifierDetector(DetectorKind.PROMPT_INJECTION, invoker, objectMapper, backendModel,
                INJECTION_DEFINITION, InjectionMarkerDetector.REASON);
    }

    @Bean
    public BackendClassifierDetector harmfulContentBackendDetector(BackendInvoker invoker) {
        return new BackendClassifierDetector(DetectorKind.HARMFUL_CONTENT, invoker, objectMapper, backendModel,
                HARMFUL_DEFINITION, HarmfulLexiconDetector.REASON);
    }

    @Bean
    public BackendPiiDetector backendPiiDetector(BackendInvoker invoker) {
        return new BackendPiiDetector(invoker, objectMapper, backendModel);
    }

    @Bean
    public HybridDetector injectionHybridDetector(InjectionMarkerDetector heuristic, BackendInvoker invoker) {
        return new HybridDetector(DetectorKind.PROMPT_INJECTION, heuristic, injectionBackendDetector(invoker));
    }

    @Bean
    public HybridDetector harmfulContentHybridDetector(HarmfulLexiconDetector heuristic, BackendInvoker invoker) {
        return new HybridDetector(DetectorKind.HARMFUL_CONTENT, heuristic, harmfulContentBackendDetector(invoker));
    }
}

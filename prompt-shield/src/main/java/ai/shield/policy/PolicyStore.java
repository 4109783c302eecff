package ai.shield.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class PolicyStore {
    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicyLoader loader;
    private final List<PolicyValidator> validators;
    private final Resource defaultSource;
    private final AtomicReference<Policy> active = new AtomicReference<>();

    @Autowired
    public PolicyStore(
            PolicyLoader loader,
            List<PolicyValidator> validators,
            ResourceLoader resourceLoader,
            @Value("${shield.policy.location:classpath:policy.json}") String location
    ) {
        this(loader, validators, resourceLoader.getResource(location));
    }

    public PolicyStore(PolicyLoader loader, List<PolicyValidator> validators, Resource defaultSource) {
        this.loader = loader;
        this.validators = List.copyOf(validators);
        this.defaultSource = defaultSource;
        Policy initial = load(defaultSource);
        active.set(initial);
        log.info("event=policy_loaded version={} source={}", initial.version(), defaultSource.getDescription());
    }

    public Policy load(Resource source) {
        Policy policy = loader.load(source);
        for (PolicyValidator validator : validators) {
            try {
                validator.validate(policy);
            } catch (ConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }
        return policy;
    }

    public Policy current() {
        return active.get();
    }

    public Policy reload() {
        return reload(defaultSource);
    }

    /**
     * Builds a snapshot from {@code source} and swaps it in. On failure the active snapshot is
     * left untouched and the error propagates.
     */
    public Policy reload(Resource source) {
        Policy next;
        try {
            next = load(source);
        } catch (ConfigException e) {
            log.warn("event=policy_reload_failed source={} reason={}", source.getDescription(), e.getMessage());
            throw e;
        }
        Policy previous = active.getAndSet(next);
        log.info("event=policy_reloaded previous_version={} version={}", previous.version(), next.version());
        return next;
    }
}

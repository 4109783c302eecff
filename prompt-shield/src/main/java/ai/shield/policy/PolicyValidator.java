package ai.shield.policy;

@FunctionalInterface
public interface PolicyValidator {
    void validate(Policy policy);
}

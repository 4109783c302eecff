package ai.shield.api;

import ai.shield.policy.PolicyStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/policy")
public class PolicyController {
    private final PolicyStore policyStore;

    public PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @GetMapping
    public Map<String, Object> current() {
        return policyStore.current().describe();
    }

    /** Invalid sources surface as 422 and leave the active policy in place. */
    @PostMapping("/reload")
    public Map<String, Object> reload() {
        return policyStore.reload().describe();
    }
}

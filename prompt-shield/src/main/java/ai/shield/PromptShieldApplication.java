package ai.shield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptShieldApplication {
    public static void main(String[] args) {
        SpringApplication.run(PromptShieldApplication.class, args);
    }
}

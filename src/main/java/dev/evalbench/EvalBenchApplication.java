package dev.evalbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the bulk evaluation service.
 *
 * <p>Serves the REST adapter under {@code /api/evaluations} on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EvalBenchApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvalBenchApplication.class, args);
    }
}

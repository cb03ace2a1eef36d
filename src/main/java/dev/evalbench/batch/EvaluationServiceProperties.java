package dev.evalbench.batch;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "evalbench.evaluation-service")
public record EvaluationServiceProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        String bulkPath,
        String abortPath,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}

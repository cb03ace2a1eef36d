package dev.evalbench.batch;

import java.time.Duration;
import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the remote evaluation service.
 *
 * <p>Timeouts are externalized via {@code evalbench.evaluation-service.*} properties.
 * The client defaults to JSON content type and is qualified as
 * {@code "evaluationServiceRestClient"}.
 */
@Configuration
@EnableRetry
public class EvaluationServiceConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the evaluation service.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties base URL and timeouts
     * @return a named REST client bean for injection into {@link RestEvaluationServiceClient}
     */
    @Bean
    public RestClient evaluationServiceRestClient(
            RestClient.Builder builder, EvaluationServiceProperties properties) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /** Runs blocking bulk calls off the caller's thread, one thread per in-flight call. */
    @Bean
    public Executor evaluationServiceExecutor() {
        var executor = new SimpleAsyncTaskExecutor("evaluation-service-");
        executor.setDaemon(true);
        return executor;
    }
}

package dev.evalbench.batch;

import dev.evalbench.evaluation.EvaluationException;
import dev.evalbench.evaluation.EvaluationException.ErrorKind;
import dev.evalbench.evaluation.EvaluationSummary;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class RestEvaluationServiceClient implements EvaluationServiceClient {

    private static final Logger log = LoggerFactory.getLogger(RestEvaluationServiceClient.class);

    private final RestClient restClient;
    private final Executor executor;
    private final EvaluationServiceProperties properties;

    public RestEvaluationServiceClient(
            @Qualifier("evaluationServiceRestClient") RestClient restClient,
            @Qualifier("evaluationServiceExecutor") Executor executor,
            EvaluationServiceProperties properties) {
        this.restClient = restClient;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Posts the whole question list to the bulk endpoint.
     * Never retried: a second submission would evaluate every question again.
     */
    @Override
    public CompletableFuture<EvaluationSummary> evaluateBatch(BulkEvaluationRequest request) {
        return CompletableFuture.supplyAsync(() -> post(request), executor);
    }

    EvaluationSummary post(BulkEvaluationRequest request) {
        BulkEvaluationResponse response;
        try {
            response = restClient.post()
                    .uri(properties.bulkPath())
                    .body(request)
                    .retrieve()
                    .body(BulkEvaluationResponse.class);
        } catch (RestClientException e) {
            throw new EvaluationException(ErrorKind.REMOTE_FAILURE,
                    "Evaluation service call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new EvaluationException(ErrorKind.REMOTE_FAILURE,
                    "Evaluation service returned an empty response for " + request.websocketId());
        }
        return response.toSummary();
    }

    /**
     * Ask the service to stop a bulk run.
     * Retries on transient RestClientException with exponential backoff.
     */
    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${evalbench.evaluation-service.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${evalbench.evaluation-service.retry.delay-ms}",
                    multiplierExpression = "${evalbench.evaluation-service.retry.multiplier}"
            )
    )
    public boolean abort(String correlationId) {
        restClient.post()
                .uri(properties.abortPath(), correlationId)
                .retrieve()
                .toBodilessEntity();
        log.info("Evaluation service acknowledged abort of {}", correlationId);
        return true;
    }

    @Recover
    boolean recoverAbort(RestClientException e, String correlationId) {
        log.warn("Abort request failed after retries for {}: {}", correlationId, e.getMessage());
        return false;
    }
}

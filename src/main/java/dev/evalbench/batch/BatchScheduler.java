package dev.evalbench.batch;

import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.evaluation.EvaluationException;
import dev.evalbench.evaluation.EvaluationException.ErrorKind;
import dev.evalbench.evaluation.EvaluationSummary;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Submits a validated dataset to the evaluation service as a single bulk call.
 *
 * <p>Preconditions are checked synchronously so that callers see {@link ErrorKind#INVALID_INPUT}
 * and {@link ErrorKind#SESSION_CONFLICT} before anything is sent. Everything that goes wrong after
 * the call is issued, including the timeout, completes the returned future exceptionally with
 * {@link ErrorKind#REMOTE_FAILURE}. Submissions are never retried.
 */
@Service
public class BatchScheduler {

  private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

  private final EvaluationServiceClient client;
  private final BatchProperties properties;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public BatchScheduler(EvaluationServiceClient client, BatchProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  /**
   * Submits every row of the dataset in one call.
   *
   * @param dataset a valid dataset
   * @param config agent and correlation settings
   * @return a future completed with the service's terminal summary
   * @throws EvaluationException with {@code INVALID_INPUT} if the dataset is invalid, or {@code
   *     SESSION_CONFLICT} if a submission for the same correlation id is still in flight
   */
  public CompletableFuture<EvaluationSummary> submit(ParsedDataset dataset, BatchConfig config) {
    if (!dataset.isValid()) {
      throw new EvaluationException(
          ErrorKind.INVALID_INPUT,
          "Dataset is invalid: " + String.join("; ", dataset.errors()));
    }
    if (dataset.rows().isEmpty()) {
      throw new EvaluationException(ErrorKind.INVALID_INPUT, "Dataset contains no questions");
    }
    String correlationId = config.correlationId();
    if (!inFlight.add(correlationId)) {
      throw new EvaluationException(
          ErrorKind.SESSION_CONFLICT, "A submission is already in flight for " + correlationId);
    }

    Duration timeout = properties.timeoutFor(dataset.size());
    log.info(
        "Submitting {} questions for agent {} (correlation {}, batch size {}, timeout {}s)",
        dataset.size(),
        config.agentCode(),
        correlationId,
        config.batchSize(),
        timeout.toSeconds());

    CompletableFuture<EvaluationSummary> call;
    try {
      call = client.evaluateBatch(toRequest(dataset, config));
    } catch (RuntimeException e) {
      inFlight.remove(correlationId);
      return CompletableFuture.failedFuture(toRemoteFailure(e, correlationId, timeout));
    }

    CompletableFuture<EvaluationSummary> result = new CompletableFuture<>();
    call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete(
            (summary, error) -> {
              inFlight.remove(correlationId);
              if (error == null) {
                log.info(
                    "Bulk evaluation {} finished: {} successful, {} failed",
                    correlationId,
                    summary.successful(),
                    summary.failed());
                result.complete(summary);
              } else {
                EvaluationException failure = toRemoteFailure(error, correlationId, timeout);
                log.warn("Bulk evaluation {} failed: {}", correlationId, failure.getMessage());
                result.completeExceptionally(failure);
              }
            });
    return result;
  }

  /**
   * Asks the evaluation service to stop a run. Failures are logged, never thrown.
   *
   * @return true if the service acknowledged the abort
   */
  public boolean abort(String correlationId) {
    try {
      return client.abort(correlationId);
    } catch (RuntimeException e) {
      log.warn("Best-effort abort of {} failed: {}", correlationId, e.getMessage());
      return false;
    }
  }

  public boolean isInFlight(String correlationId) {
    return inFlight.contains(correlationId);
  }

  static BulkEvaluationRequest toRequest(ParsedDataset dataset, BatchConfig config) {
    List<BulkEvaluationQuestion> questions =
        dataset.rows().stream().map(BulkEvaluationQuestion::from).toList();
    return new BulkEvaluationRequest(
        config.agentCode(),
        questions,
        config.agentName(),
        config.agentDescription(),
        config.context(),
        config.correlationId(),
        config.batchSize());
  }

  private static EvaluationException toRemoteFailure(
      Throwable error, String correlationId, Duration timeout) {
    Throwable cause = unwrap(error);
    if (cause instanceof TimeoutException) {
      return new EvaluationException(
          ErrorKind.REMOTE_FAILURE,
          "Bulk evaluation %s timed out after %ds".formatted(correlationId, timeout.toSeconds()),
          cause);
    }
    if (cause instanceof EvaluationException evaluationException
        && evaluationException.getKind() == ErrorKind.REMOTE_FAILURE) {
      return evaluationException;
    }
    return new EvaluationException(
        ErrorKind.REMOTE_FAILURE, "Bulk evaluation failed: " + cause.getMessage(), cause);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}

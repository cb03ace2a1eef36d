package dev.evalbench.batch;

import dev.evalbench.evaluation.EvaluationSummary;
import java.util.concurrent.CompletableFuture;

/** Remote service that runs an agent over a list of questions. */
public interface EvaluationServiceClient {

  /**
   * Submits a whole question list in one call. The future completes with the terminal summary,
   * while per-question progress is pushed separately under the request's {@code websocket_id}.
   */
  CompletableFuture<EvaluationSummary> evaluateBatch(BulkEvaluationRequest request);

  /**
   * Asks the service to stop evaluating a bulk run.
   *
   * @return true if the service acknowledged the abort
   */
  boolean abort(String correlationId);
}

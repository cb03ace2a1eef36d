package dev.evalbench.evaluation;

import java.util.List;

/**
 * Terminal response of a bulk evaluation call, as reported by the evaluation service.
 *
 * @param total number of questions evaluated
 * @param successful number of questions answered successfully
 * @param failed number of questions that failed
 * @param avgLatencyMs mean per-question response time in milliseconds
 * @param totalTimeS wall-clock duration of the whole run in seconds
 * @param results the complete per-question result set
 */
public record EvaluationSummary(
    int total,
    int successful,
    int failed,
    double avgLatencyMs,
    double totalTimeS,
    List<EvaluationResult> results) {

  public EvaluationSummary {
    results = results == null ? List.of() : List.copyOf(results);
  }
}

package dev.evalbench.evaluation;

import org.jspecify.annotations.Nullable;

/**
 * The agent's answer to one question of a bulk run.
 *
 * <p>Results are keyed by {@code questionIndex}: a later result for the same index replaces the
 * earlier one instead of being appended.
 *
 * @param questionIndex 0-based position of the question in the submitted dataset
 * @param question the question text
 * @param response the agent's response (empty when the question failed)
 * @param responseTimeMs wall-clock time the agent took to answer, in milliseconds
 * @param status whether the question was answered or failed
 * @param error the per-question failure message, when {@code status} is {@code ERROR}
 * @param expectedAnswer the reference answer from the dataset, if any
 */
public record EvaluationResult(
    int questionIndex,
    String question,
    String response,
    double responseTimeMs,
    ResultStatus status,
    @Nullable String error,
    @Nullable String expectedAnswer) {

  public EvaluationResult {
    if (questionIndex < 0) {
      throw new IllegalArgumentException("questionIndex must be >= 0 but was " + questionIndex);
    }
    question = question == null ? "" : question;
    response = response == null ? "" : response;
    status = status == null ? ResultStatus.ERROR : status;
  }

  public boolean succeeded() {
    return status == ResultStatus.SUCCESS;
  }

  /** Returns a copy carrying the given expected answer. */
  public EvaluationResult withExpectedAnswer(@Nullable String answer) {
    return new EvaluationResult(
        questionIndex, question, response, responseTimeMs, status, error, answer);
  }
}

package dev.evalbench.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.evaluation.EvaluationSummary;
import dev.evalbench.evaluation.ResultStatus;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Top-level JSON response of the evaluation service's bulk endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkEvaluationResponse(
    @JsonProperty("total_questions") int totalQuestions,
    @JsonProperty("successful_count") int successfulCount,
    @JsonProperty("failed_count") int failedCount,
    @JsonProperty("average_response_time") double averageResponseTime,
    @JsonProperty("total_time") double totalTime,
    List<Item> results) {

  public BulkEvaluationResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** Per-question entry of the response. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Item(
      @JsonProperty("question_index") int questionIndex,
      String question,
      String response,
      @JsonProperty("response_time") double responseTime,
      ResultStatus status,
      @Nullable String error,
      @JsonProperty("expected_answer") @Nullable String expectedAnswer) {

    EvaluationResult toResult() {
      return new EvaluationResult(
          questionIndex, question, response, responseTime, status, error, expectedAnswer);
    }
  }

  public EvaluationSummary toSummary() {
    return new EvaluationSummary(
        totalQuestions,
        successfulCount,
        failedCount,
        averageResponseTime,
        totalTime,
        results.stream().map(Item::toResult).toList());
  }
}

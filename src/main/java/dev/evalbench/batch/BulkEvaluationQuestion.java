package dev.evalbench.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.evalbench.dataset.QuestionRow;
import org.jspecify.annotations.Nullable;

/** One question of a {@link BulkEvaluationRequest}, in the evaluation service's wire format. */
public record BulkEvaluationQuestion(
    String question,
    @JsonProperty("expected_answer") @Nullable String expectedAnswer,
    @Nullable String context,
    @Nullable String category) {

  static BulkEvaluationQuestion from(QuestionRow row) {
    return new BulkEvaluationQuestion(
        row.question(), row.expectedAnswer(), row.context(), row.category());
  }
}

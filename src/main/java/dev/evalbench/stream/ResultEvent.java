package dev.evalbench.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.evaluation.ResultStatus;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a single question streamed while a bulk run executes. Events may arrive in any
 * order and may repeat for the same {@code questionIndex}.
 *
 * @param id             producer-assigned event id
 * @param questionIndex  0-based index of the question in the submitted dataset, required
 * @param question       the question text
 * @param response       the agent's response
 * @param responseTimeMs time taken to answer, in milliseconds
 * @param status         success or error
 * @param error          failure message for errored questions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultEvent(
        @Nullable String id,
        @JsonProperty(value = "question_index", required = true) Integer questionIndex,
        String question,
        String response,
        @JsonProperty("response_time_ms") double responseTimeMs,
        ResultStatus status,
        @Nullable String error
) {

    public ResultEvent {
        if (questionIndex == null || questionIndex < 0) {
            throw new IllegalArgumentException("question_index must be >= 0 but was " + questionIndex);
        }
    }

    /** Converts this event into the result it records. */
    public EvaluationResult toResult(@Nullable String expectedAnswer) {
        return new EvaluationResult(
                questionIndex, question, response, responseTimeMs, status, error, expectedAnswer);
    }
}

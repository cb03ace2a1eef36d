package dev.evalbench.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Overall completion update streamed while a bulk run executes.
 *
 * @param progressPercent               completion percentage (0-100)
 * @param currentQuestionIndex          index of the question the service is working on
 * @param estimatedTimeRemainingSeconds the service's estimate of the remaining time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressEvent(
        @JsonProperty("progress_percent") double progressPercent,
        @JsonProperty("current_question_index") int currentQuestionIndex,
        @JsonProperty("estimated_time_remaining_seconds") double estimatedTimeRemainingSeconds
) {
}

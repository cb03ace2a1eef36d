package dev.evalbench.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One test question parsed from an uploaded CSV row.
 *
 * @param question the question text sent to the agent (trimmed, never blank)
 * @param expectedAnswer optional reference answer
 * @param context optional context passed alongside the question
 * @param category optional grouping label
 * @param extras remaining columns in header order, keyed by header name
 */
public record QuestionRow(
    String question,
    @Nullable String expectedAnswer,
    @Nullable String context,
    @Nullable String category,
    Map<String, String> extras) {

  public QuestionRow {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    question = question.trim();
    extras =
        extras == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  /** Convenience constructor for a row with only a question and an expected answer. */
  public QuestionRow(String question, @Nullable String expectedAnswer) {
    this(question, expectedAnswer, null, null, Map.of());
  }
}

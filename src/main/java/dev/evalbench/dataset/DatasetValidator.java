package dev.evalbench.dataset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses raw CSV text into a validated {@link ParsedDataset} of test questions.
 *
 * <p>The expected layout is a header row followed by one question per line:
 *
 * <pre>
 * question,expected_answer,category
 * What is 2+2?,4,Math
 * </pre>
 *
 * <p>Fields are split on every comma. Quoted fields containing the delimiter are not supported;
 * surrounding quotes are stripped from each field. Parsing never throws: problems are reported
 * through {@link ParsedDataset#errors()}.
 */
public final class DatasetValidator {

  private static final Logger log = LoggerFactory.getLogger(DatasetValidator.class);

  /** Maximum number of data lines parsed from a single upload. */
  public static final int MAX_ROWS = 1000;

  static final String EMPTY_INPUT_ERROR =
      "CSV is empty: a header row and at least one data row are required";

  static final String NO_QUESTION_COLUMN_ERROR =
      "No question column found: the header row must contain a column whose name includes"
          + " \"question\" (or is named \"q\" or \"query\")";

  static final String NO_VALID_ROWS_ERROR =
      "No valid rows: the CSV contains no data row with a non-empty question";

  private DatasetValidator() {
    // utility class
  }

  /**
   * Parses and validates an uploaded question file.
   *
   * @param rawText the UTF-8 CSV content; null is treated as empty
   * @return the parsed dataset, invalid with descriptive errors when the input is unusable
   */
  public static ParsedDataset parse(@Nullable String rawText) {
    try {
      return doParse(rawText == null ? "" : rawText);
    } catch (RuntimeException e) {
      log.warn("Unexpected failure while parsing CSV", e);
      return ParsedDataset.failed("Failed to parse CSV: " + e.getMessage());
    }
  }

  private static ParsedDataset doParse(String rawText) {
    List<String> lines = rawText.lines().filter(line -> !line.isBlank()).toList();
    if (lines.isEmpty()) {
      return ParsedDataset.failed(EMPTY_INPUT_ERROR);
    }

    List<String> headers = splitFields(lines.get(0));
    String questionColumn = detectQuestionColumn(headers);
    List<String> errors = new ArrayList<>();
    if (questionColumn == null) {
      errors.add(NO_QUESTION_COLUMN_ERROR + "; found headers " + headers);
    }

    int dataLines = lines.size() - 1;
    int parsedLines = Math.min(dataLines, MAX_ROWS);
    List<QuestionRow> rows = new ArrayList<>(parsedLines);
    for (int i = 1; i <= parsedLines; i++) {
      QuestionRow row = toRow(headers, questionColumn, splitFields(lines.get(i)));
      if (row != null) {
        rows.add(row);
      }
    }

    if (dataLines > MAX_ROWS) {
      errors.add(
          "Too many rows: the CSV has %d data rows but at most %d are allowed; rows after %d were truncated"
              .formatted(dataLines, MAX_ROWS, MAX_ROWS));
    }
    if (questionColumn != null && rows.isEmpty()) {
      errors.add(NO_VALID_ROWS_ERROR);
    }

    log.debug(
        "Parsed CSV: {} headers, {} data lines, {} rows kept, {} errors",
        headers.size(),
        dataLines,
        rows.size(),
        errors.size());
    return new ParsedDataset(headers, rows, questionColumn, errors);
  }

  /**
   * Finds the header that holds the question text: the first whose lowercase form contains
   * "question", or equals "q" or "query".
   */
  static @Nullable String detectQuestionColumn(List<String> headers) {
    for (String header : headers) {
      String lower = header.toLowerCase(Locale.ROOT);
      if (lower.contains("question") || lower.equals("q") || lower.equals("query")) {
        return header;
      }
    }
    return null;
  }

  private static @Nullable QuestionRow toRow(
      List<String> headers, @Nullable String questionColumn, List<String> values) {
    String question = null;
    String expectedAnswer = null;
    String context = null;
    String category = null;
    Map<String, String> extras = new LinkedHashMap<>();

    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      String value = i < values.size() ? values.get(i) : "";
      if (value.isEmpty()) {
        continue;
      }
      String lower = header.toLowerCase(Locale.ROOT);
      if (header.equals(questionColumn)) {
        question = firstNonEmpty(question, value);
      } else if (lower.contains("expected") || lower.contains("answer")) {
        expectedAnswer = firstNonEmpty(expectedAnswer, value);
      } else if (lower.contains("context")) {
        context = firstNonEmpty(context, value);
      } else if (lower.contains("category")) {
        category = firstNonEmpty(category, value);
      } else {
        extras.putIfAbsent(header, value);
      }
    }

    if (question == null || question.isBlank()) {
      return null;
    }
    return new QuestionRow(question, expectedAnswer, context, category, extras);
  }

  private static String firstNonEmpty(@Nullable String current, String candidate) {
    return current != null ? current : candidate;
  }

  private static List<String> splitFields(String line) {
    String[] parts = line.split(",", -1);
    List<String> fields = new ArrayList<>(parts.length);
    for (String part : parts) {
      fields.add(unquote(part.trim()));
    }
    return fields;
  }

  private static String unquote(String field) {
    String result = field;
    if (result.startsWith("\"")) {
      result = result.substring(1);
    }
    if (result.endsWith("\"")) {
      result = result.substring(0, result.length() - 1);
    }
    return result.trim();
  }
}

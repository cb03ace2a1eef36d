package dev.evalbench.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Structured result of validating an uploaded question CSV.
 *
 * <p>Validity is derived from the error list, so a dataset is valid exactly when it carries no
 * errors. Rows are kept even for invalid datasets so callers can show diagnostics.
 *
 * @param headers header names in file order, trimmed and unquoted
 * @param rows parsed question rows in file order (at most {@link DatasetValidator#MAX_ROWS})
 * @param questionColumn the detected question header, or null when none matched
 * @param errors every validation error, untruncated
 */
public record ParsedDataset(
    List<String> headers,
    List<QuestionRow> rows,
    @Nullable String questionColumn,
    List<String> errors) {

  private static final int PREVIEW_ROWS = 5;

  public ParsedDataset {
    headers = headers == null ? List.of() : List.copyOf(headers);
    rows = rows == null ? List.of() : List.copyOf(rows);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** Creates an invalid dataset carrying a single error and no rows. */
  public static ParsedDataset failed(String error) {
    return new ParsedDataset(List.of(), List.of(), null, List.of(error));
  }

  @JsonProperty("valid")
  public boolean isValid() {
    return errors.isEmpty();
  }

  /** Returns the first few rows for display before a run is started. */
  @JsonProperty("preview")
  public List<QuestionRow> preview() {
    return rows.subList(0, Math.min(PREVIEW_ROWS, rows.size()));
  }

  public int size() {
    return rows.size();
  }
}

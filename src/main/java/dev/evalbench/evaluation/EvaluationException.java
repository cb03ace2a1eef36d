package dev.evalbench.evaluation;

/**
 * Failure of a bulk evaluation operation, classified by {@link ErrorKind}.
 *
 * <p>Failures of individual questions are not exceptions: they are recorded as {@link
 * EvaluationResult}s with status {@link ResultStatus#ERROR}.
 */
public class EvaluationException extends RuntimeException {

  /** Classification of evaluation failures. */
  public enum ErrorKind {
    /** The dataset or request failed validation. */
    INVALID_INPUT,
    /** The uploaded text could not be parsed at all. */
    PARSE_FAILURE,
    /** A session is already running. */
    SESSION_CONFLICT,
    /** The evaluation service call itself failed or timed out. */
    REMOTE_FAILURE
  }

  private final ErrorKind kind;

  public EvaluationException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public EvaluationException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}

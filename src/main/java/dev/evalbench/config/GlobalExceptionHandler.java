package dev.evalbench.config;

import dev.evalbench.evaluation.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>The detail always carries the full exception message, so every validation error of a dataset
 * reaches the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps an {@link EvaluationException} to a status derived from its kind.
   *
   * @param ex the classified failure
   * @return a Problem Detail whose title names the error kind
   */
  @ExceptionHandler(EvaluationException.class)
  ProblemDetail handleEvaluation(EvaluationException ex) {
    HttpStatus status =
        switch (ex.getKind()) {
          case INVALID_INPUT, PARSE_FAILURE -> HttpStatus.BAD_REQUEST;
          case SESSION_CONFLICT -> HttpStatus.CONFLICT;
          case REMOTE_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    if (status.is5xxServerError()) {
      log.warn("Evaluation service failure: {}", ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    problem.setTitle(ex.getKind().name());
    return problem;
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /** Maps a command that is invalid in the current session status to 409 Conflict. */
  @ExceptionHandler(IllegalStateException.class)
  ProblemDetail handleIllegalState(IllegalStateException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }
}

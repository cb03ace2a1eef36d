package dev.evalbench.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.evalbench.evaluation.EvaluationException;
import dev.evalbench.evaluation.EvaluationException.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void invalidInputMapsTo400WithFullMessage() {
    String message = "Dataset is invalid: first error; second error; third error";

    ProblemDetail problem =
        handler.handleEvaluation(new EvaluationException(ErrorKind.INVALID_INPUT, message));

    assertThat(problem.getStatus()).isEqualTo(400);
    assertThat(problem.getDetail()).isEqualTo(message);
    assertThat(problem.getTitle()).isEqualTo("INVALID_INPUT");
  }

  @Test
  void parseFailureMapsTo400() {
    assertThat(
            handler
                .handleEvaluation(new EvaluationException(ErrorKind.PARSE_FAILURE, "bad"))
                .getStatus())
        .isEqualTo(400);
  }

  @Test
  void sessionConflictMapsTo409() {
    assertThat(
            handler
                .handleEvaluation(new EvaluationException(ErrorKind.SESSION_CONFLICT, "running"))
                .getStatus())
        .isEqualTo(409);
  }

  @Test
  void remoteFailureMapsTo502() {
    assertThat(
            handler
                .handleEvaluation(new EvaluationException(ErrorKind.REMOTE_FAILURE, "timed out"))
                .getStatus())
        .isEqualTo(502);
  }

  @Test
  void illegalArgumentMapsTo400AndIllegalStateTo409() {
    assertThat(handler.handleIllegalArgument(new IllegalArgumentException("x")).getStatus())
        .isEqualTo(400);
    assertThat(handler.handleIllegalState(new IllegalStateException("y")).getStatus())
        .isEqualTo(409);
  }
}

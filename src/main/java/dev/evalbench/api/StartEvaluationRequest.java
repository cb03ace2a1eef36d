package dev.evalbench.api;

import dev.evalbench.session.StartRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** JSON body of {@code POST /api/evaluations/start}. */
public record StartEvaluationRequest(
    @NotBlank String agentCode,
    String agentName,
    String agentDescription,
    Map<String, Object> context,
    @Min(1) @Max(100) Integer batchSize) {

  StartRequest toStartRequest() {
    return new StartRequest(agentCode, agentName, agentDescription, context, batchSize);
  }
}

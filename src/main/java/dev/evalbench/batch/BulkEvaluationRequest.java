package dev.evalbench.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON request body for the evaluation service's bulk endpoint. {@code websocket_id} is the
 * correlation id the service tags its push messages with.
 */
public record BulkEvaluationRequest(
    @JsonProperty("agent_code") String agentCode,
    List<BulkEvaluationQuestion> questions,
    @JsonProperty("agent_name") @Nullable String agentName,
    @JsonProperty("agent_description") @Nullable String agentDescription,
    Map<String, Object> context,
    @JsonProperty("websocket_id") String websocketId,
    @JsonProperty("batch_size") int batchSize) {

  public BulkEvaluationRequest {
    questions = questions == null ? List.of() : List.copyOf(questions);
    context = context == null ? Map.of() : context;
  }
}

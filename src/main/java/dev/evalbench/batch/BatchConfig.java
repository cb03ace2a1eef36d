package dev.evalbench.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of one bulk submission.
 *
 * @param agentCode the code of the agent under evaluation
 * @param agentName display name of the agent, if known
 * @param agentDescription description of the agent, if known
 * @param context extra context forwarded to the agent with every question
 * @param correlationId id under which progress and results are streamed back
 * @param batchSize parallelism hint for the evaluation service, at least 1
 */
public record BatchConfig(
    String agentCode,
    @Nullable String agentName,
    @Nullable String agentDescription,
    Map<String, Object> context,
    String correlationId,
    int batchSize) {

  public BatchConfig {
    if (agentCode == null) {
      agentCode = "";
    }
    if (correlationId == null || correlationId.isBlank()) {
      throw new IllegalArgumentException("correlationId must not be blank");
    }
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
    }
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }
}

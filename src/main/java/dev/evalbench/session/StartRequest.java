package dev.evalbench.session;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * What the caller supplies to start a bulk run.
 *
 * @param agentCode        code of the agent to evaluate
 * @param agentName        display name, also used in exports
 * @param agentDescription description forwarded to the service
 * @param context          extra context forwarded with every question
 * @param batchSize        parallelism hint, the configured default when null
 */
public record StartRequest(
        String agentCode,
        @Nullable String agentName,
        @Nullable String agentDescription,
        @Nullable Map<String, Object> context,
        @Nullable Integer batchSize
) {

    public StartRequest(String agentCode) {
        this(agentCode, null, null, null, null);
    }
}

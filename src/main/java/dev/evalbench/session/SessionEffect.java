package dev.evalbench.session;

import dev.evalbench.batch.BatchConfig;
import dev.evalbench.dataset.ParsedDataset;

/** Side effect requested by a transition, executed by the orchestrator after the state is published. */
public interface SessionEffect {

    record Subscribe(String correlationId) implements SessionEffect {}

    record Unsubscribe(String correlationId) implements SessionEffect {}

    record SubmitBatch(ParsedDataset dataset, BatchConfig config) implements SessionEffect {}

    record AbortRemote(String correlationId) implements SessionEffect {}
}

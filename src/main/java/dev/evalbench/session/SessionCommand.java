package dev.evalbench.session;

import dev.evalbench.batch.BatchConfig;
import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.evaluation.EvaluationSummary;
import dev.evalbench.stream.ProgressEvent;
import dev.evalbench.stream.ResultEvent;
import java.time.Instant;

/**
 * Input to {@link SessionReducer}. Caller commands carry no correlation id; commands that
 * originate from a run carry the id they belong to and are dropped when it is not the current one.
 */
public interface SessionCommand {

    /** Commands produced by a specific run. */
    interface RunScoped extends SessionCommand {
        String correlationId();
    }

    record Start(
            String correlationId,
            ParsedDataset dataset,
            BatchConfig config,
            Instant startedAt,
            double estimatedRemainingSeconds
    ) implements SessionCommand {}

    record Pause() implements SessionCommand {}

    record Resume() implements SessionCommand {}

    record Cancel() implements SessionCommand {}

    record Clear() implements SessionCommand {}

    record Progress(String correlationId, ProgressEvent event) implements RunScoped {}

    record Result(String correlationId, ResultEvent event) implements RunScoped {}

    record Log(String correlationId, String line) implements RunScoped {}

    record SummaryReceived(String correlationId, EvaluationSummary summary, Instant at)
            implements RunScoped {}

    record SubmissionFailed(String correlationId, String message, Instant at)
            implements RunScoped {}
}

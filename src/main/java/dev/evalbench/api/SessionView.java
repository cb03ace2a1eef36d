package dev.evalbench.api;

import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.evaluation.AggregateStats;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.session.EvaluationSession;
import dev.evalbench.session.SessionState;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything a client needs to render the bulk evaluation screen.
 *
 * @param session current session snapshot
 * @param stats statistics of the current results
 * @param results results in question index order
 * @param logs most recent streamed log lines
 * @param dataset the currently selected dataset, if any
 */
public record SessionView(
    EvaluationSession session,
    AggregateStats stats,
    List<EvaluationResult> results,
    List<String> logs,
    @Nullable ParsedDataset dataset) {

  static SessionView of(SessionState state, @Nullable ParsedDataset selected, Instant now) {
    return new SessionView(
        state.session(), state.stats(now), state.resultList(), state.logs(), selected);
  }
}

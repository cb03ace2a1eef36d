package dev.evalbench.session;

import dev.evalbench.batch.BatchConfig;
import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.dataset.QuestionRow;
import dev.evalbench.evaluation.AggregateStats;
import dev.evalbench.evaluation.EvaluationResult;
import dev.evalbench.evaluation.ResultAggregator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Everything the orchestrator owns about the current run: the session snapshot, the dataset
 * that was submitted, the per-question results and the rolling log.
 *
 * @param session     current session snapshot
 * @param dataset     the dataset of the current run, null while idle
 * @param config      submission settings of the current run, null while idle
 * @param results     results keyed by question index
 * @param logs        most recent log lines, oldest first
 * @param logCapacity maximum number of log lines kept
 */
public record SessionState(
        EvaluationSession session,
        @Nullable ParsedDataset dataset,
        @Nullable BatchConfig config,
        SortedMap<Integer, EvaluationResult> results,
        List<String> logs,
        int logCapacity
) {

    public SessionState {
        if (logCapacity < 1) {
            throw new IllegalArgumentException("logCapacity must be >= 1 but was " + logCapacity);
        }
        results = results == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(results));
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static SessionState initial(int logCapacity) {
        return new SessionState(EvaluationSession.idle(), null, null, null, null, logCapacity);
    }

    /** Results in question index order. */
    public List<EvaluationResult> resultList() {
        return List.copyOf(results.values());
    }

    public @Nullable String agentName() {
        return config == null ? null : config.agentName();
    }

    /**
     * Statistics of the current result set. Elapsed time is frozen once the run has ended.
     *
     * @param now the reference instant while the run is still going
     */
    public AggregateStats stats(Instant now) {
        Instant end = session.completedAt() != null ? session.completedAt() : now;
        return ResultAggregator.computeStats(resultList(), session.startTime(), end);
    }

    /** Expected answer of the dataset row at {@code index}, if any. */
    @Nullable String expectedAnswerAt(int index) {
        if (dataset == null || index < 0 || index >= dataset.rows().size()) {
            return null;
        }
        QuestionRow row = dataset.rows().get(index);
        return row.expectedAnswer();
    }

    SessionState withSession(EvaluationSession newSession) {
        return new SessionState(newSession, dataset, config, results, logs, logCapacity);
    }

    SessionState withResult(EvaluationResult result) {
        TreeMap<Integer, EvaluationResult> updated = new TreeMap<>(results);
        updated.put(result.questionIndex(), result);
        return new SessionState(session, dataset, config, updated, logs, logCapacity);
    }

    SessionState withResults(EvaluationSession newSession, List<EvaluationResult> replacement) {
        TreeMap<Integer, EvaluationResult> updated = new TreeMap<>();
        for (EvaluationResult result : replacement) {
            updated.put(result.questionIndex(), result);
        }
        return new SessionState(newSession, dataset, config, updated, logs, logCapacity);
    }

    SessionState withLog(String line) {
        List<String> updated = new ArrayList<>(logs);
        updated.add(line);
        while (updated.size() > logCapacity) {
            updated.remove(0);
        }
        return new SessionState(session, dataset, config, results, updated, logCapacity);
    }
}

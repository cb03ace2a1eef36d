package dev.evalbench.evaluation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Computes {@link AggregateStats} from a result set.
 *
 * <p>All methods are pure functions of their arguments. Counts are recomputed from the
 * authoritative result list on every call, so they can never drift from it.
 */
public final class ResultAggregator {

  private ResultAggregator() {}

  /**
   * Computes statistics for the given results.
   *
   * @param results the current result set, one entry per question index
   * @param startedAt when the session started, or null if it never started
   * @param endedAt the reference instant for elapsed time (now, or when the session ended)
   * @return derived statistics; all zero for an empty result set
   */
  public static AggregateStats computeStats(
      List<EvaluationResult> results, @Nullable Instant startedAt, Instant endedAt) {
    int total = results.size();
    int successful = (int) results.stream().filter(EvaluationResult::succeeded).count();
    int failed = total - successful;
    double successRate = total == 0 ? 0.0 : (double) successful / total * 100.0;
    double avgLatency =
        results.stream().mapToDouble(EvaluationResult::responseTimeMs).average().orElse(0.0);
    return new AggregateStats(
        total, successful, failed, successRate, avgLatency, elapsedSeconds(startedAt, endedAt));
  }

  /** Seconds between two instants, never negative; 0 when there is no start. */
  public static double elapsedSeconds(@Nullable Instant startedAt, Instant endedAt) {
    if (startedAt == null || endedAt.isBefore(startedAt)) {
      return 0.0;
    }
    return Duration.between(startedAt, endedAt).toMillis() / 1000.0;
  }
}

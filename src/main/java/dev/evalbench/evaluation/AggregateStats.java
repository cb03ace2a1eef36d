package dev.evalbench.evaluation;

/**
 * Statistics derived from a result set. Always recomputed by {@link ResultAggregator}, never
 * updated in place.
 *
 * @param total number of results
 * @param successful results with status {@code SUCCESS}
 * @param failed results with status {@code ERROR}
 * @param successRate percentage of successful results, 0 when there are none
 * @param avgLatencyMs mean response time in milliseconds, 0 when there are no results
 * @param totalTimeS elapsed seconds since the session started
 */
public record AggregateStats(
    int total,
    int successful,
    int failed,
    double successRate,
    double avgLatencyMs,
    double totalTimeS) {

  public static AggregateStats empty() {
    return new AggregateStats(0, 0, 0, 0.0, 0.0, 0.0);
  }
}

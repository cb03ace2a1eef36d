package dev.evalbench.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.evalbench.fixture.EvaluationResultBuilder;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultAggregatorTest {

  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void emptyResultsYieldZeroStats() {
    AggregateStats stats = ResultAggregator.computeStats(List.of(), null, START);

    assertThat(stats).isEqualTo(AggregateStats.empty());
  }

  @Test
  void countsSuccessesAndFailures() {
    List<EvaluationResult> results =
        List.of(
            new EvaluationResultBuilder().index(0).responseTimeMs(100).build(),
            new EvaluationResultBuilder().index(1).responseTimeMs(200).build(),
            new EvaluationResultBuilder().index(2).responseTimeMs(300).failed("timeout").build(),
            new EvaluationResultBuilder().index(3).responseTimeMs(400).build());

    AggregateStats stats =
        ResultAggregator.computeStats(results, START, START.plusMillis(12_500));

    assertThat(stats.total()).isEqualTo(4);
    assertThat(stats.successful()).isEqualTo(3);
    assertThat(stats.failed()).isEqualTo(1);
    assertThat(stats.successRate()).isCloseTo(75.0, within(1e-9));
    assertThat(stats.avgLatencyMs()).isCloseTo(250.0, within(1e-9));
    assertThat(stats.totalTimeS()).isCloseTo(12.5, within(1e-9));
  }

  @Test
  void elapsedTimeIsZeroWithoutStartOrWhenClockGoesBackwards() {
    assertThat(ResultAggregator.elapsedSeconds(null, START)).isZero();
    assertThat(ResultAggregator.elapsedSeconds(START, START.minusSeconds(5))).isZero();
  }
}

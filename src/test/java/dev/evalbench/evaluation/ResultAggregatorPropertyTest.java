package dev.evalbench.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/** Property-based tests for the counting invariants of {@link ResultAggregator}. */
class ResultAggregatorPropertyTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Property
  void successfulPlusFailedEqualsTotal(@ForAll("outcomes") List<Boolean> outcomes) {
    AggregateStats stats = ResultAggregator.computeStats(toResults(outcomes), NOW, NOW);

    assertThat(stats.successful() + stats.failed()).isEqualTo(outcomes.size());
    assertThat(stats.total()).isEqualTo(outcomes.size());
    assertThat(stats.successRate()).isBetween(0.0, 100.0);
    if (outcomes.isEmpty()) {
      assertThat(stats.successRate()).isZero();
    }
  }

  @Provide
  Arbitrary<List<Boolean>> outcomes() {
    return Arbitraries.of(true, false).list().ofMaxSize(200);
  }

  private static List<EvaluationResult> toResults(List<Boolean> outcomes) {
    List<EvaluationResult> results = new ArrayList<>();
    for (int i = 0; i < outcomes.size(); i++) {
      ResultStatus status = outcomes.get(i) ? ResultStatus.SUCCESS : ResultStatus.ERROR;
      results.add(new EvaluationResult(i, "q" + i, "r" + i, i, status, null, null));
    }
    return results;
  }
}

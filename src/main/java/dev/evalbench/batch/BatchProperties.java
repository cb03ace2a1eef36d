package dev.evalbench.batch;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Timeout settings for bulk submissions, bound from {@code evalbench.batch.*}.
 *
 * <ul>
 *   <li>{@code per-question-timeout} - time budget per question (default 60s)
 *   <li>{@code minimum-timeout} - lower bound of the whole submission's timeout (default 5m)
 * </ul>
 *
 * <p>A submission of {@code n} questions times out after {@code max(minimum-timeout, n *
 * per-question-timeout)}.
 */
@Configuration
@ConfigurationProperties(prefix = "evalbench.batch")
public class BatchProperties {

  private Duration perQuestionTimeout = Duration.ofSeconds(60);
  private Duration minimumTimeout = Duration.ofMinutes(5);

  @PostConstruct
  void validate() {
    if (perQuestionTimeout.isNegative() || perQuestionTimeout.isZero()) {
      throw new IllegalStateException(
          "evalbench.batch.per-question-timeout must be positive, got: " + perQuestionTimeout);
    }
    if (minimumTimeout.isNegative()) {
      throw new IllegalStateException(
          "evalbench.batch.minimum-timeout must not be negative, got: " + minimumTimeout);
    }
  }

  /** Timeout for a submission of {@code questionCount} questions. */
  public Duration timeoutFor(int questionCount) {
    Duration scaled = perQuestionTimeout.multipliedBy(Math.max(questionCount, 0));
    return scaled.compareTo(minimumTimeout) > 0 ? scaled : minimumTimeout;
  }

  public Duration getPerQuestionTimeout() {
    return perQuestionTimeout;
  }

  public void setPerQuestionTimeout(Duration perQuestionTimeout) {
    this.perQuestionTimeout = perQuestionTimeout;
  }

  public Duration getMinimumTimeout() {
    return minimumTimeout;
  }

  public void setMinimumTimeout(Duration minimumTimeout) {
    this.minimumTimeout = minimumTimeout;
  }
}

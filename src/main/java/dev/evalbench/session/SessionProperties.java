package dev.evalbench.session;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for evaluation sessions.
 *
 * <p>Properties are bound from {@code evalbench.session.*} in application.yml.
 *
 * <ul>
 *   <li>{@code seconds-per-batch} - assumed duration of one batch, used for the initial remaining
 *       time estimate (default 30)
 *   <li>{@code log-capacity} - number of streamed log lines kept per session (default 50)
 *   <li>{@code default-batch-size} - batch size when the caller does not give one (default 5)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "evalbench.session")
public class SessionProperties {

  private int secondsPerBatch = 30;
  private int logCapacity = 50;
  private int defaultBatchSize = 5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (secondsPerBatch < 0) {
      throw new IllegalStateException(
          "evalbench.session.seconds-per-batch must be >= 0, got: " + secondsPerBatch);
    }
    if (logCapacity < 1) {
      throw new IllegalStateException(
          "evalbench.session.log-capacity must be >= 1, got: " + logCapacity);
    }
    if (defaultBatchSize < 1) {
      throw new IllegalStateException(
          "evalbench.session.default-batch-size must be >= 1, got: " + defaultBatchSize);
    }
  }

  /** Initial remaining-time estimate: one {@code secondsPerBatch} slot per batch. */
  public double estimateSeconds(int total, int batchSize) {
    int batches = (total + batchSize - 1) / batchSize;
    return (double) batches * secondsPerBatch;
  }

  public int getSecondsPerBatch() {
    return secondsPerBatch;
  }

  public void setSecondsPerBatch(int secondsPerBatch) {
    this.secondsPerBatch = secondsPerBatch;
  }

  public int getLogCapacity() {
    return logCapacity;
  }

  public void setLogCapacity(int logCapacity) {
    this.logCapacity = logCapacity;
  }

  public int getDefaultBatchSize() {
    return defaultBatchSize;
  }

  public void setDefaultBatchSize(int defaultBatchSize) {
    this.defaultBatchSize = defaultBatchSize;
  }
}

package dev.evalbench.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Renders bulk evaluation results as CSV or JSON reports.
 *
 * <p>The CSV report has one row per question in index order. The JSON report wraps the same
 * results with a metadata block holding the export date, the agent name and the aggregate
 * statistics. Rendering is side-effect free; {@link #export} additionally writes the report to the
 * configured output directory.
 */
@Service
public class EvaluationExporter {

  private static final Logger log = LoggerFactory.getLogger(EvaluationExporter.class);

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

  static final String CSV_HEADER =
      "Question Index,Question,Agent Response,Status,Response Time (ms),Expected Answer";

  private final Path outputDir;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  public EvaluationExporter(
      @Value("${evalbench.export.output-dir:${user.home}/.evalbench/exports}") String outputDir,
      Clock clock,
      ObjectMapper objectMapper) {
    this.outputDir = Path.of(outputDir);
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  /**
   * Renders results as CSV, ordered by question index with a 1-based index column.
   *
   * @param results the results to export
   * @return the CSV document, header row first
   */
  public String toCsv(List<EvaluationResult> results) {
    StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
    for (EvaluationResult result : sorted(results)) {
      csv.append(result.questionIndex() + 1)
          .append(',')
          .append(quote(result.question()))
          .append(',')
          .append(quote(result.response()))
          .append(',')
          .append(statusLabel(result.status()))
          .append(',')
          .append(String.format(Locale.US, "%.2f", result.responseTimeMs()))
          .append(',')
          .append(quote(result.expectedAnswer()))
          .append('\n');
    }
    return csv.toString();
  }

  /**
   * Renders results and statistics as a pretty-printed JSON report.
   *
   * @param results the results to export
   * @param stats statistics computed from the same results
   * @param agentName the evaluated agent, if known
   * @return the JSON document
   * @throws JsonProcessingException if serialization fails
   */
  public String toJson(
      List<EvaluationResult> results, AggregateStats stats, @Nullable String agentName)
      throws JsonProcessingException {
    ObjectNode root = objectMapper.createObjectNode();

    ObjectNode metadata = root.putObject("metadata");
    metadata.put("export_date", OffsetDateTime.now(clock).toString());
    metadata.put("agent_name", agentName);
    metadata.put("total", stats.total());
    metadata.put("successful", stats.successful());
    metadata.put("failed", stats.failed());
    metadata.put("success_rate", stats.successRate());
    metadata.put("avg_latency_ms", stats.avgLatencyMs());
    metadata.put("total_time_s", stats.totalTimeS());

    ArrayNode array = root.putArray("results");
    for (EvaluationResult result : sorted(results)) {
      ObjectNode node = array.addObject();
      node.put("question_index", result.questionIndex());
      node.put("question", result.question());
      node.put("response", result.response());
      node.put("response_time_ms", result.responseTimeMs());
      node.put("status", statusLabel(result.status()));
      node.put("error", result.error());
      node.put("expected_answer", result.expectedAnswer());
    }

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
  }

  /**
   * Renders a report in the requested format as UTF-8 bytes.
   *
   * @throws IOException if JSON serialization fails
   */
  public byte[] render(
      List<EvaluationResult> results,
      AggregateStats stats,
      @Nullable String agentName,
      ExportFormat format)
      throws IOException {
    String content =
        switch (format) {
          case CSV -> toCsv(results);
          case JSON -> toJson(results, stats, agentName);
        };
    return content.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Writes a report to the output directory, creating it if needed.
   *
   * @param label a descriptive label included in the filename (e.g., the agent name)
   * @return the path of the written report
   * @throws IOException if the directory cannot be created or the file cannot be written
   */
  public Path export(
      List<EvaluationResult> results,
      AggregateStats stats,
      @Nullable String agentName,
      ExportFormat format,
      String label)
      throws IOException {
    Files.createDirectories(outputDir);
    Path path = outputDir.resolve(fileName(format, label));
    Files.write(path, render(results, stats, agentName, format));
    log.info("Exported {} results as {} to {}", results.size(), format, path);
    return path;
  }

  /** Builds the report filename for the current time, e.g. {@code bulk-evaluation-results-…}. */
  public String fileName(ExportFormat format, String label) {
    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    return "bulk-evaluation-results-%s-%s.%s".formatted(timestamp, label, format.extension());
  }

  private static List<EvaluationResult> sorted(List<EvaluationResult> results) {
    return results.stream()
        .sorted(Comparator.comparingInt(EvaluationResult::questionIndex))
        .toList();
  }

  private static String statusLabel(ResultStatus status) {
    return status.name().toLowerCase(Locale.ROOT);
  }

  private static String quote(@Nullable String value) {
    if (value == null) {
      return "\"\"";
    }
    return "\"" + value.replace("\"", "\"\"") + "\"";
  }
}

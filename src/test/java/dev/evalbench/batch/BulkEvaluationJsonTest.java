package dev.evalbench.batch;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.evalbench.evaluation.EvaluationSummary;
import dev.evalbench.evaluation.ResultStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BulkEvaluationJsonTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void requestIsSerializedWithSnakeCaseFields() {
    BulkEvaluationRequest request =
        new BulkEvaluationRequest(
            "tutor",
            List.of(new BulkEvaluationQuestion("What is 2+2?", "4", null, "Math")),
            "Math Tutor",
            "Answers math",
            Map.of("locale", "en"),
            "run-1",
            5);

    JsonNode json = objectMapper.valueToTree(request);

    assertThat(json.get("agent_code").asText()).isEqualTo("tutor");
    assertThat(json.get("agent_name").asText()).isEqualTo("Math Tutor");
    assertThat(json.get("agent_description").asText()).isEqualTo("Answers math");
    assertThat(json.get("websocket_id").asText()).isEqualTo("run-1");
    assertThat(json.get("batch_size").asInt()).isEqualTo(5);
    assertThat(json.get("context").get("locale").asText()).isEqualTo("en");
    JsonNode question = json.get("questions").get(0);
    assertThat(question.get("question").asText()).isEqualTo("What is 2+2?");
    assertThat(question.get("expected_answer").asText()).isEqualTo("4");
    assertThat(question.get("category").asText()).isEqualTo("Math");
  }

  @Test
  void responseIsDeserializedAndMappedToSummary() throws Exception {
    String json =
        """
        {"total_questions":2,"successful_count":1,"failed_count":1,
         "average_response_time":150.5,"total_time":4.2,"unknown":true,
         "results":[
           {"question_index":0,"question":"Q0","response":"A0","response_time":100.0,"status":"success"},
           {"question_index":1,"question":"Q1","response":"","response_time":201.0,"status":"error",
            "error":"agent crashed","expected_answer":"A1"}]}
        """;

    EvaluationSummary summary =
        objectMapper.readValue(json, BulkEvaluationResponse.class).toSummary();

    assertThat(summary.total()).isEqualTo(2);
    assertThat(summary.failed()).isEqualTo(1);
    assertThat(summary.avgLatencyMs()).isEqualTo(150.5);
    assertThat(summary.totalTimeS()).isEqualTo(4.2);
    assertThat(summary.results().get(1).status()).isEqualTo(ResultStatus.ERROR);
    assertThat(summary.results().get(1).error()).isEqualTo("agent crashed");
    assertThat(summary.results().get(1).expectedAnswer()).isEqualTo("A1");
  }
}

package dev.evalbench.dataset;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link DatasetValidator}: parsing never throws, validity always agrees
 * with the error list, and well-formed files keep one row per non-blank question.
 */
class DatasetValidatorPropertyTest {

  @Property
  void parseNeverThrowsAndValidityMatchesErrors(@ForAll String rawText) {
    ParsedDataset dataset = DatasetValidator.parse(rawText);

    assertThat(dataset.isValid()).isEqualTo(dataset.errors().isEmpty());
    assertThat(dataset.size()).isLessThanOrEqualTo(DatasetValidator.MAX_ROWS);
  }

  @Property
  void rowCountEqualsNonBlankQuestionLines(@ForAll("questionLists") List<String> questions) {
    String csv = "question,expected_answer\n" + String.join("\n", questions.stream()
        .map(q -> q + ",answer")
        .toList());

    ParsedDataset dataset = DatasetValidator.parse(csv);

    long expected = questions.stream().filter(q -> !q.isBlank()).count();
    assertThat(dataset.size()).isEqualTo(expected);
    assertThat(dataset.isValid()).isEqualTo(expected > 0);
    assertThat(dataset.rows()).allSatisfy(row -> assertThat(row.question()).isNotBlank());
  }

  @Property
  void withoutQuestionHeaderDatasetIsInvalid(@ForAll("headerNames") List<String> headers) {
    String csv = String.join(",", headers) + "\nvalue";

    ParsedDataset dataset = DatasetValidator.parse(csv);

    assertThat(dataset.isValid()).isFalse();
    assertThat(dataset.errors()).anySatisfy(error -> assertThat(error).contains("question"));
  }

  @Provide
  Arbitrary<List<String>> questionLists() {
    Arbitrary<String> question =
        Arbitraries.oneOf(
            Arbitraries.strings().alpha().numeric().withChars(' ', '?').ofMinLength(1).ofMaxLength(30),
            Arbitraries.just("   "));
    return question.list().ofMinSize(1).ofMaxSize(50);
  }

  @Provide
  Arbitrary<List<String>> headerNames() {
    return Arbitraries.of("id", "answer", "expected", "category", "context", "prompt", "notes")
        .list()
        .ofMinSize(1)
        .ofMaxSize(5);
  }
}

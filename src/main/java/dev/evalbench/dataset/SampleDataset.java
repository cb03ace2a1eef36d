package dev.evalbench.dataset;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.ClassPathResource;

/** Bundled template CSV users can download to see the expected upload format. */
public final class SampleDataset {

  public static final String FILE_NAME = "sample-questions.csv";

  private static final String RESOURCE_PATH = "datasets/" + FILE_NAME;

  private SampleDataset() {
    // utility class
  }

  /**
   * Reads the sample question file from the classpath.
   *
   * @return the sample CSV content
   * @throws UncheckedIOException if the bundled resource cannot be read
   */
  public static String csv() {
    ClassPathResource resource = new ClassPathResource(RESOURCE_PATH);
    try (InputStream is = resource.getInputStream()) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read bundled " + RESOURCE_PATH, e);
    }
  }
}

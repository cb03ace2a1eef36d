package dev.evalbench.evaluation;

import java.util.Locale;

/** Report formats supported by {@link EvaluationExporter}. */
public enum ExportFormat {
  CSV("csv", "text/csv"),
  JSON("json", "application/json");

  private final String extension;
  private final String mediaType;

  ExportFormat(String extension, String mediaType) {
    this.extension = extension;
    this.mediaType = mediaType;
  }

  public String extension() {
    return extension;
  }

  public String mediaType() {
    return mediaType;
  }

  /**
   * Resolves a format from its case-insensitive name.
   *
   * @throws IllegalArgumentException if the name is not a supported format
   */
  public static ExportFormat fromName(String name) {
    if (name != null) {
      for (ExportFormat format : values()) {
        if (format.extension.equals(name.trim().toLowerCase(Locale.ROOT))) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported export format: " + name);
  }
}

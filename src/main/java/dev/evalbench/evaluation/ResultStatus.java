package dev.evalbench.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of evaluating a single question. */
public enum ResultStatus {
  @JsonProperty("success")
  SUCCESS,
  @JsonProperty("error")
  ERROR
}

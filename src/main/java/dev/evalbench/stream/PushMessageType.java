package dev.evalbench.stream;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Kinds of messages delivered on the push channel during a bulk run. */
public enum PushMessageType {
    @JsonProperty("progress")
    PROGRESS,
    @JsonProperty("result")
    RESULT,
    @JsonProperty("log")
    LOG
}

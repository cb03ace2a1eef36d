package dev.evalbench.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Envelope of a push-channel message. The payload is decoded lazily by
 * {@link EventStreamConsumer} according to {@link #type()}.
 *
 * @param type          message kind
 * @param correlationId the bulk run this message belongs to
 * @param payload       raw JSON payload
 * @param ts            when the message was produced, if the producer sent one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushMessage(
        PushMessageType type,
        @JsonProperty("correlation_id") String correlationId,
        JsonNode payload,
        @Nullable Instant ts
) {

    public PushMessage {
        if (type == null) {
            throw new IllegalArgumentException("Push message type is required");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("Push message correlation_id is required");
        }
    }

    public static PushMessage of(PushMessageType type, String correlationId, JsonNode payload, Instant ts) {
        return new PushMessage(type, correlationId, payload, ts);
    }

    /** Returns this message, or a copy stamped with {@code receivedAt} when the producer sent no timestamp. */
    public PushMessage stampedIfMissing(Instant receivedAt) {
        return ts != null ? this : new PushMessage(type, correlationId, payload, receivedAt);
    }
}

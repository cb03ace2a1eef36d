package dev.evalbench.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Subscribes to the push channel on behalf of a bulk run and turns raw {@link PushMessage}s into
 * typed events for a {@link StreamListener}.
 *
 * <p>Exactly one subscription exists per correlation id. Messages whose payload cannot be
 * decoded are logged and skipped so a single malformed message never tears down the stream.
 */
@Component
public class EventStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(EventStreamConsumer.class);

    private final PushEventChannel channel;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public EventStreamConsumer(PushEventChannel channel, ObjectMapper objectMapper) {
        this.channel = channel;
        this.objectMapper = objectMapper;
    }

    /**
     * Start listening for events of a bulk run. Must be called before the batch is submitted so
     * that no early event is missed. Reopening an open correlation id replaces its listener.
     *
     * @param correlationId the bulk run to listen to
     * @param listener      receiver of decoded events
     */
    public void open(String correlationId, StreamListener listener) {
        Subscription subscription =
                channel.subscribe(correlationId, message -> dispatch(message, listener));
        Subscription previous = subscriptions.put(correlationId, subscription);
        if (previous != null) {
            previous.close();
        }
        log.debug("Opened event stream for {}", correlationId);
    }

    /**
     * Stop listening for events of a bulk run. Closing an unknown id is a no-op.
     *
     * @param correlationId the bulk run to stop listening to
     */
    public void close(String correlationId) {
        Subscription subscription = subscriptions.remove(correlationId);
        if (subscription != null) {
            subscription.close();
            log.debug("Closed event stream for {}", correlationId);
        }
    }

    public boolean isOpen(String correlationId) {
        return subscriptions.containsKey(correlationId);
    }

    void dispatch(PushMessage message, StreamListener listener) {
        String correlationId = message.correlationId();
        try {
            switch (message.type()) {
                case PROGRESS -> listener.onProgress(correlationId,
                        objectMapper.treeToValue(message.payload(), ProgressEvent.class));
                case RESULT -> listener.onResult(correlationId,
                        objectMapper.treeToValue(message.payload(), ResultEvent.class));
                case LOG -> listener.onLog(correlationId, logLine(message.payload()));
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping undecodable {} message for {}: {}",
                    message.type(), correlationId, e.getMessage());
        }
    }

    private static String logLine(JsonNode payload) {
        if (payload == null || payload.isNull()) {
            return "";
        }
        if (payload.isTextual()) {
            return payload.asText();
        }
        JsonNode message = payload.get("message");
        return message != null ? message.asText() : payload.toString();
    }
}

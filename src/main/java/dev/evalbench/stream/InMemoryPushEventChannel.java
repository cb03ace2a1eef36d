package dev.evalbench.stream;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process push channel. Transports (the REST ingress endpoint, a WebSocket bridge) publish
 * into it and subscribers receive messages synchronously on the publishing thread.
 *
 * <p>Handlers are held in a {@link ConcurrentHashMap} of copy-on-write lists keyed by
 * correlation id, so publishing and subscribing may happen concurrently.
 */
@Component
public class InMemoryPushEventChannel implements PushEventChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPushEventChannel.class);

    private final ConcurrentHashMap<String, List<Consumer<PushMessage>>> handlers =
            new ConcurrentHashMap<>();

    @Override
    public Subscription subscribe(String correlationId, Consumer<PushMessage> handler) {
        handlers.computeIfAbsent(correlationId, id -> new CopyOnWriteArrayList<>()).add(handler);
        return () -> unsubscribe(correlationId, handler);
    }

    /**
     * Delivers a message to every handler subscribed to its correlation id.
     *
     * @param message the message to deliver
     * @return the number of handlers that received it
     */
    public int publish(PushMessage message) {
        List<Consumer<PushMessage>> targets = handlers.get(message.correlationId());
        if (targets == null || targets.isEmpty()) {
            log.debug("No subscriber for {} message on {}", message.type(), message.correlationId());
            return 0;
        }
        for (Consumer<PushMessage> handler : targets) {
            handler.accept(message);
        }
        return targets.size();
    }

    /**
     * Returns whether anything is listening on the given correlation id.
     *
     * @param correlationId the bulk run to check
     * @return true if at least one handler is registered
     */
    public boolean hasSubscribers(String correlationId) {
        List<Consumer<PushMessage>> targets = handlers.get(correlationId);
        return targets != null && !targets.isEmpty();
    }

    private void unsubscribe(String correlationId, Consumer<PushMessage> handler) {
        handlers.computeIfPresent(correlationId, (id, list) -> {
            list.remove(handler);
            return list.isEmpty() ? null : list;
        });
    }
}

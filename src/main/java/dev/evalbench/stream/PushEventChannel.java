package dev.evalbench.stream;

import java.util.function.Consumer;

/**
 * Source of push messages keyed by correlation id. Delivery order across question indices is
 * not guaranteed.
 */
public interface PushEventChannel {

    /**
     * Registers a handler for every message published under {@code correlationId}.
     *
     * @param correlationId the bulk run to listen to
     * @param handler       invoked on the publishing thread for each message
     * @return a handle that removes the handler when closed
     */
    Subscription subscribe(String correlationId, Consumer<PushMessage> handler);
}

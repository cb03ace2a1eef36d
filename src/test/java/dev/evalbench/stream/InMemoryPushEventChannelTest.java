package dev.evalbench.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPushEventChannelTest {

    private InMemoryPushEventChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InMemoryPushEventChannel();
    }

    @Test
    void publishDeliversOnlyToMatchingCorrelationId() {
        List<PushMessage> a = new ArrayList<>();
        List<PushMessage> b = new ArrayList<>();
        channel.subscribe("run-a", a::add);
        channel.subscribe("run-b", b::add);

        int delivered = channel.publish(log("run-a", "hello"));

        assertThat(delivered).isEqualTo(1);
        assertThat(a).hasSize(1);
        assertThat(b).isEmpty();
    }

    @Test
    void publishWithoutSubscriberDeliversNothing() {
        assertThat(channel.publish(log("nobody", "hello"))).isZero();
    }

    @Test
    void closingSubscriptionStopsDelivery() {
        List<PushMessage> received = new ArrayList<>();
        Subscription subscription = channel.subscribe("run-a", received::add);

        subscription.close();
        subscription.close();
        channel.publish(log("run-a", "late"));

        assertThat(received).isEmpty();
        assertThat(channel.hasSubscribers("run-a")).isFalse();
    }

    private static PushMessage log(String correlationId, String line) {
        return PushMessage.of(PushMessageType.LOG, correlationId, JsonNodeFactory.instance.textNode(line),
                Instant.parse("2026-03-01T10:00:00Z"));
    }
}

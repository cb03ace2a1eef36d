package dev.evalbench.stream;

/** Handle to an open push-channel subscription. Closing it twice is harmless. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

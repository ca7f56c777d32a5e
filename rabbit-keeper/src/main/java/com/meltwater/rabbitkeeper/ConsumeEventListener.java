package com.meltwater.rabbitkeeper;

/**
 * Listener that gets notified about consume, handler and ack/reject events of a {@link ConsumerSupervisor}.
 *
 * Callbacks run on the consumer thread of the binding and must not block.
 */
public interface ConsumeEventListener {

    default void received(Message message) {}

    default void beforeAck(Message message) {}

    default void beforeReject(Message message) {}

    default void handlerFailed(Message message, Throwable error) {}

    default void afterFailedAck(Message message, Exception error) {}

    default void afterFailedReject(Message message, Exception error) {}
}

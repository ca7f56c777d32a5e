package com.meltwater.rabbitkeeper;

/**
 * Business logic run for every message of a queue registered on a {@link ConsumerSupervisor}.
 *
 * Returning normally acknowledges the message. Throwing anything rejects it with requeue;
 * the consumer keeps running either way.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Message message) throws Exception;
}

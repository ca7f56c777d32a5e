package com.meltwater.rabbitkeeper;

import java.io.IOException;

/**
 * Used to report the outcome of processing a {@link Message}. Exactly one of the methods must be called per message.
 */
public interface Acknowledger {

    /**
     * Acknowledges this single message on the channel it was delivered on.
     *
     * @throws IOException if the broker call fails, for example because the channel is closed
     */
    void ack() throws IOException;

    /**
     * Rejects this single message and asks the broker to requeue it.
     *
     * @throws IOException if the broker call fails, for example because the channel is closed
     */
    void reject() throws IOException;
}

package com.meltwater.rabbitkeeper;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The messages delivered to one consumer tag, in delivery order.
 *
 * The stream ends when the consumer is cancelled, by the client or by the broker, or when the channel it
 * was attached on shuts down. Messages delivered before the end are still handed out by {@link #next()}.
 */
public class DeliveryStream {

    private static final Object END = new Object();

    private final String consumerTag;
    private final BlockingQueue<Object> deliveries = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile boolean drained = false;

    public DeliveryStream(String consumerTag) {
        this.consumerTag = consumerTag;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    /**
     * Blocks until the next message arrives or the stream ends.
     *
     * @return the next message, or null once the stream has ended
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Message next() throws InterruptedException {
        if (drained) {
            return null;
        }
        Object item = deliveries.take();
        if (item == END) {
            drained = true;
            return null;
        }
        return (Message) item;
    }

    public void deliver(Message message) {
        deliveries.add(message);
    }

    /**
     * Marks the end of the stream. Only the first call has an effect.
     */
    public void end() {
        if (ended.compareAndSet(false, true)) {
            deliveries.add(END);
        }
    }

    public boolean isEnded() {
        return ended.get();
    }
}

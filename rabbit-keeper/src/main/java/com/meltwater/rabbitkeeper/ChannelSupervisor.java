package com.meltwater.rabbitkeeper;

import com.rabbitmq.client.AMQP;

import java.io.IOException;

/**
 * Owns one broker channel and keeps it open: when the broker or the network closes it, a new one is
 * opened in the background. All operations run against whatever channel is current when they are called.
 *
 * @see com.meltwater.rabbitkeeper.impl.RedialingChannelSupervisor
 */
public interface ChannelSupervisor {

    /**
     * Declares a durable, non auto-delete, non internal exchange. Idempotent for identical arguments.
     *
     * @param name the name of the exchange
     * @param type the exchange type, for example "direct" or "topic"
     * @throws IOException if the broker call fails
     */
    AMQP.Exchange.DeclareOk exchangeDeclare(String name, String type) throws IOException;

    /**
     * Declares a durable, non exclusive, non auto-delete queue. Idempotent for identical arguments.
     *
     * @param name the name of the queue
     * @return the declare result carrying the current message and consumer counts
     * @throws IOException if the broker call fails
     */
    AMQP.Queue.DeclareOk queueDeclare(String name) throws IOException;

    /**
     * Binds a queue to an exchange.
     *
     * @throws IOException if the broker call fails
     */
    AMQP.Queue.BindOk queueBind(String queue, String routingKey, String exchange) throws IOException;

    /**
     * Publishes a non mandatory message with content type text/plain.
     *
     * @throws IOException if the broker call fails
     */
    void publish(String exchange, String routingKey, byte[] body) throws IOException;

    /**
     * Starts a manual-ack, non exclusive consumer on the queue.
     *
     * @param queue the queue to consume from
     * @param consumerTag the client chosen tag identifying the consumer, used by {@link #cancel(String)}
     * @return the stream of deliveries, ending when the consumer is cancelled or the channel closes
     * @throws ConsumeAttachException if the consumer could not be registered
     */
    DeliveryStream consume(String queue, String consumerTag) throws ConsumeAttachException;

    /**
     * Stops deliveries to the consumer with the given tag. Its {@link DeliveryStream} ends once the broker
     * confirms the cancellation.
     *
     * @throws IOException if the broker call fails or the tag is not consuming on the current channel
     */
    void cancel(String consumerTag) throws IOException;

    /**
     * @return true if the current channel is open
     */
    boolean isOpen();

    /**
     * Stops re-opening channels and closes the current one. Calling it again has no effect.
     *
     * @throws IOException if closing the channel fails
     */
    void close() throws IOException;
}

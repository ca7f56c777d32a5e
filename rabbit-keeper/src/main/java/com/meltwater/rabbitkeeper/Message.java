package com.meltwater.rabbitkeeper;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/**
 * One message delivered by the broker to a consumer.
 *
 * The {@link Acknowledger} is bound to the channel the message arrived on, delivery tags are only valid there.
 */
public class Message {

    public final String consumerTag;

    /**
     * The delivery tag, the exchange the message was published to and its routing key.
     */
    public final Envelope envelope;

    public final AMQP.BasicProperties basicProperties;

    public final byte[] payload;

    public final Acknowledger acknowledger;

    public Message(String consumerTag,
                   Envelope envelope,
                   AMQP.BasicProperties basicProperties,
                   byte[] payload,
                   Acknowledger acknowledger) {
        this.consumerTag = consumerTag;
        this.envelope = envelope;
        this.basicProperties = basicProperties;
        this.payload = payload;
        this.acknowledger = acknowledger;
    }

    @Override
    public String toString() {
        return "{" +
                "consumerTag:'" + consumerTag + "'" +
                ", deliveryTag:" + envelope.getDeliveryTag() +
                ", redeliver:" + envelope.isRedeliver() +
                ", exchange:'" + envelope.getExchange() + "'" +
                ", routingKey:'" + envelope.getRoutingKey() + "'" +
                ", size:" + payload.length +
                '}';
    }
}

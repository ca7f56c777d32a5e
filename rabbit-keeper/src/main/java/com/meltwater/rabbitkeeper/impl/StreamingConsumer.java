package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.Acknowledger;
import com.meltwater.rabbitkeeper.DeliveryStream;
import com.meltwater.rabbitkeeper.Message;
import com.meltwater.rabbitkeeper.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;

/**
 * Feeds the deliveries of one consumer tag into a {@link DeliveryStream} and ends the stream when the
 * consumer is cancelled or the channel shuts down.
 */
class StreamingConsumer extends DefaultConsumer {

    private static final Logger log = new Logger(StreamingConsumer.class);

    private final DeliveryStream stream;
    private final String queue;

    StreamingConsumer(Channel channel, String queue, DeliveryStream stream) {
        super(channel);
        this.queue = queue;
        this.stream = stream;
    }

    @Override
    public void handleConsumeOk(String consumerTag) {
        super.handleConsumeOk(consumerTag);
        log.infoWithParams("Consumer registered and ready to receive messages.",
                "channelNr", getChannel().getChannelNumber(),
                "queue", queue,
                "consumerTag", consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        log.infoWithParams("Consumer cancelled. It will not receive any more messages.",
                "channelNr", getChannel().getChannelNumber(),
                "queue", queue,
                "consumerTag", consumerTag);
        stream.end();
    }

    @Override
    public void handleCancel(String consumerTag) {
        log.warnWithParams("Consumer cancelled by the broker. It will not receive any more messages.",
                "channelNr", getChannel().getChannelNumber(),
                "queue", queue,
                "consumerTag", consumerTag);
        stream.end();
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        if (sig.isInitiatedByApplication()) {
            log.infoWithParams("Channel closed, ending delivery stream.",
                    "queue", queue,
                    "consumerTag", consumerTag);
        } else {
            log.warnWithParams("Channel closed unexpectedly, ending delivery stream.",
                    "queue", queue,
                    "consumerTag", consumerTag,
                    "reason", sig.getMessage());
        }
        stream.end();
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        log.traceWithParams("Consumer received message",
                "consumerTag", consumerTag,
                "deliveryTag", envelope.getDeliveryTag(),
                "messageId", properties == null ? null : properties.getMessageId());
        stream.deliver(new Message(consumerTag, envelope, properties, body,
                createAcknowledger(getChannel(), envelope.getDeliveryTag())));
    }

    private static Acknowledger createAcknowledger(final Channel channel, final long deliveryTag) {
        return new Acknowledger() {
            @Override
            public void ack() throws IOException {
                try {
                    channel.basicAck(deliveryTag, false);
                } catch (ShutdownSignalException e) {
                    throw new IOException("Channel closed before message " + deliveryTag + " could be acked", e);
                }
            }

            @Override
            public void reject() throws IOException {
                try {
                    channel.basicReject(deliveryTag, true);
                } catch (ShutdownSignalException e) {
                    throw new IOException("Channel closed before message " + deliveryTag + " could be rejected", e);
                }
            }
        };
    }
}

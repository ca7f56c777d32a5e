package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.ChannelSupervisor;
import com.meltwater.rabbitkeeper.ConsumeEventListener;
import com.meltwater.rabbitkeeper.DeliveryStream;
import com.meltwater.rabbitkeeper.Message;
import com.meltwater.rabbitkeeper.MessageHandler;
import com.meltwater.rabbitkeeper.util.BackoffAlgorithm;
import com.meltwater.rabbitkeeper.util.Logger;
import rx.Observable;
import rx.Scheduler;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Consumes one queue under one consumer tag for as long as the owning supervisor is running.
 *
 * Every time the delivery stream ends, because the channel was re-dialed or the broker cancelled the
 * consumer, the loop waits for the backoff and attaches again to whatever channel is current. Failed
 * attaches are retried with the same backoff. Messages are processed one at a time; a message is acked or
 * rejected before the next one is taken.
 */
public class ConsumerLoop implements Runnable {

    private static final Logger log = new Logger(ConsumerLoop.class);

    private final String consumerTag;
    private final String queue;
    private final MessageHandler handler;
    private final ChannelSupervisor channelSupervisor;
    private final BackoffAlgorithm backoff;
    private final ConsumeEventListener listener;
    private final BooleanSupplier running;
    private final Observable<?> stopSignal;
    private final Scheduler scheduler;

    /**
     * @param running checked between iterations, the loop exits once it returns false
     * @param stopSignal emits on stop, cutting short a backoff that is being waited out
     * @param scheduler runs the backoff timers and the attach calls
     */
    public ConsumerLoop(String consumerTag,
                        String queue,
                        MessageHandler handler,
                        ChannelSupervisor channelSupervisor,
                        BackoffAlgorithm backoff,
                        ConsumeEventListener listener,
                        BooleanSupplier running,
                        Observable<?> stopSignal,
                        Scheduler scheduler) {
        this.consumerTag = consumerTag;
        this.queue = queue;
        this.handler = handler;
        this.channelSupervisor = channelSupervisor;
        this.backoff = backoff;
        this.listener = listener;
        this.running = running;
        this.stopSignal = stopSignal;
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        int delayMs = 0;
        while (running.getAsBoolean()) {
            DeliveryStream stream;
            try {
                stream = attach(delayMs);
            } catch (RuntimeException e) {
                log.warnWithParams("Interrupted while attaching consumer.",
                        "consumerTag", consumerTag,
                        "error", String.valueOf(e));
                break;
            }
            if (stream == null) {
                break;
            }
            if (!running.getAsBoolean()) {
                // stop() may have issued its cancel before this consumer was registered
                cancelQuietly();
            }
            try {
                drain(stream);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running.getAsBoolean()) {
                break;
            }
            log.infoWithParams("Delivery stream ended, re-attaching consumer after backoff.",
                    "consumerTag", consumerTag,
                    "queue", queue);
            delayMs = backoff.getDelayMs(0);
        }
        log.infoWithParams("Consumer loop exited.", "consumerTag", consumerTag, "queue", queue);
    }

    /**
     * Waits the initial delay, then consumes, retrying failures with the backoff until it succeeds.
     *
     * @return the delivery stream, or null if the supervisor was stopped first
     */
    private DeliveryStream attach(int initialDelayMs) {
        Observable<DeliveryStream> consume = Observable.defer(() -> {
            if (!running.getAsBoolean()) {
                return Observable.<DeliveryStream>empty();
            }
            return Observable.<DeliveryStream>fromCallable(() -> channelSupervisor.consume(queue, consumerTag));
        });
        BackoffRetryHandler retryHandler = new BackoffRetryHandler(
                "attach consumer " + consumerTag + " to queue " + queue, backoff, scheduler);
        return Observable.timer(initialDelayMs, TimeUnit.MILLISECONDS, scheduler)
                .takeUntil(stopSignal)
                .concatMap(tick -> consume.retryWhen(errors -> retryHandler.call(errors).takeUntil(stopSignal)))
                .toBlocking()
                .firstOrDefault(null);
    }

    private void drain(DeliveryStream stream) throws InterruptedException {
        Message message;
        while ((message = stream.next()) != null) {
            final Message current = message;
            notifyListener("received", current, () -> listener.received(current));
            HandlerOutcome outcome = HandlerInvoker.invoke(handler, current);
            if (outcome.isOk()) {
                ack(current);
            } else {
                notifyListener("handlerFailed", current, () -> listener.handlerFailed(current, outcome.getCause()));
                reject(current);
            }
        }
    }

    private void ack(Message message) {
        notifyListener("beforeAck", message, () -> listener.beforeAck(message));
        try {
            message.acknowledger.ack();
        } catch (IOException | RuntimeException e) {
            log.warnWithParams("Failed to ack message.",
                    "consumerTag", consumerTag,
                    "message", message,
                    "error", String.valueOf(e));
            notifyListener("afterFailedAck", message, () -> listener.afterFailedAck(message, e));
        }
    }

    private void reject(Message message) {
        notifyListener("beforeReject", message, () -> listener.beforeReject(message));
        try {
            message.acknowledger.reject();
        } catch (IOException | RuntimeException e) {
            log.warnWithParams("Failed to reject message.",
                    "consumerTag", consumerTag,
                    "message", message,
                    "error", String.valueOf(e));
            notifyListener("afterFailedReject", message, () -> listener.afterFailedReject(message, e));
        }
    }

    // A failing listener must not cost the message its ack or reject.
    private void notifyListener(String event, Message message, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warnWithParams("Consume event listener failed.",
                    "event", event,
                    "consumerTag", consumerTag,
                    "message", message,
                    "error", String.valueOf(e));
        }
    }

    private void cancelQuietly() {
        try {
            channelSupervisor.cancel(consumerTag);
        } catch (IOException | RuntimeException e) {
            log.warnWithParams("Failed to cancel consumer attached during shutdown.",
                    "consumerTag", consumerTag,
                    "error", String.valueOf(e));
        }
    }
}

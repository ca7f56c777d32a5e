package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.BrokerConnection;
import com.meltwater.rabbitkeeper.ChannelSupervisor;
import com.meltwater.rabbitkeeper.ConsumeAttachException;
import com.meltwater.rabbitkeeper.DeliveryStream;
import com.meltwater.rabbitkeeper.SupervisorSettings;
import com.meltwater.rabbitkeeper.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import rx.Observable;
import rx.Scheduler;
import rx.Subscription;
import rx.schedulers.Schedulers;
import rx.subjects.PublishSubject;
import rx.subjects.Subject;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * A {@link ChannelSupervisor} that listens for unexpected shutdowns of its channel and re-dials a new one.
 *
 * Shutdown signals of the current channel are pushed into a subject; the re-dial pipeline moves them onto
 * the supervisor {@link Scheduler} (the client library must not be called back from its own connection
 * thread), closes what is left of the old channel, opens a new one and retries with the configured backoff
 * until it succeeds or {@link #close()} is called.
 *
 * The current channel field is only written under the supervisor lock and never null after construction.
 */
public class RedialingChannelSupervisor implements ChannelSupervisor {

    private static final Logger log = new Logger(RedialingChannelSupervisor.class);

    private static final AMQP.BasicProperties TEXT_PLAIN = new AMQP.BasicProperties.Builder()
            .contentType("text/plain")
            .build();

    private final BrokerConnection connection;
    private final SupervisorSettings settings;
    private final Scheduler scheduler;

    private final Subject<ShutdownSignalException, ShutdownSignalException> closeSignals =
            PublishSubject.<ShutdownSignalException>create().toSerialized();
    private final PublishSubject<Boolean> stopSignal = PublishSubject.create();
    private final Subscription redialSubscription;

    private volatile Channel channel;
    private ShutdownListener channelListener;
    private volatile boolean stopped = false;

    /**
     * Opens the first channel and starts the re-dial pipeline on the io scheduler.
     *
     * @throws com.meltwater.rabbitkeeper.ConnectionException if the shared connection can not be established
     * @throws com.meltwater.rabbitkeeper.ChannelOpenException if the channel can not be opened
     */
    public RedialingChannelSupervisor(BrokerConnection connection, SupervisorSettings settings) throws IOException {
        this(connection, settings, Schedulers.io());
    }

    public RedialingChannelSupervisor(BrokerConnection connection, SupervisorSettings settings, Scheduler scheduler) throws IOException {
        this.connection = connection;
        this.settings = settings;
        this.scheduler = scheduler;
        this.redialSubscription = closeSignals
                .onBackpressureBuffer()
                .observeOn(scheduler)
                .concatMap(this::redial)
                .takeUntil(stopSignal)
                .subscribe(
                        ch -> log.infoWithParams("Channel re-established.", "channelNr", ch.getChannelNumber()),
                        error -> log.errorWithParams("Re-dial pipeline terminated unexpectedly. The channel will not be re-opened again.", error));
        try {
            synchronized (this) {
                install(connection.openChannel());
            }
        } catch (IOException e) {
            redialSubscription.unsubscribe();
            throw e;
        }
        log.infoWithParams("Channel supervisor started.",
                "channelNr", channel.getChannelNumber(),
                "settings", settings);
    }

    private Observable<Channel> redial(ShutdownSignalException cause) {
        log.warnWithParams("Channel closed, re-dialing.",
                "reason", cause.getMessage(),
                "hardError", cause.isHardError());
        return Observable.fromCallable(this::reopenChannel)
                .retryWhen(new BackoffRetryHandler("re-dial channel", settings.getRedial_backoff(), scheduler))
                .filter(ch -> ch != null);
    }

    /**
     * @return the new channel, or null if the supervisor was closed in the meantime
     */
    private synchronized Channel reopenChannel() throws IOException {
        if (stopped) {
            return null;
        }
        log.infoWithParams("Reconnecting...");
        Channel stale = channel;
        stale.removeShutdownListener(channelListener);
        if (stale.isOpen()) {
            closeQuietly(stale);
        }
        install(connection.openChannel());
        return channel;
    }

    // Must hold the lock. The field is assigned before the listener is added because the client invokes
    // the listener right away when the channel is already closed.
    private void install(Channel fresh) {
        channel = fresh;
        channelListener = cause -> onShutdown(fresh, cause);
        fresh.addShutdownListener(channelListener);
    }

    private void onShutdown(Channel source, ShutdownSignalException cause) {
        if (stopped || source != channel || cause.isInitiatedByApplication()) {
            log.debugWithParams("Ignoring channel shutdown.",
                    "channelNr", source.getChannelNumber(),
                    "stopped", stopped,
                    "current", source == channel);
            return;
        }
        closeSignals.onNext(cause);
    }

    private void closeQuietly(Channel stale) {
        try {
            stale.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warnWithParams("Unexpected error when closing stale channel.", e,
                    "channelNr", stale.getChannelNumber(),
                    "isOpen", stale.isOpen());
        }
    }

    @Override
    public AMQP.Exchange.DeclareOk exchangeDeclare(String name, String type) throws IOException {
        return channel.exchangeDeclare(name, type, true, false, false, null);
    }

    @Override
    public AMQP.Queue.DeclareOk queueDeclare(String name) throws IOException {
        return channel.queueDeclare(name, true, false, false, null);
    }

    @Override
    public AMQP.Queue.BindOk queueBind(String queue, String routingKey, String exchange) throws IOException {
        return channel.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void publish(String exchange, String routingKey, byte[] body) throws IOException {
        channel.basicPublish(exchange, routingKey, false, false, TEXT_PLAIN, body);
    }

    @Override
    public DeliveryStream consume(String queue, String consumerTag) throws ConsumeAttachException {
        final Channel current = channel;
        final DeliveryStream stream = new DeliveryStream(consumerTag);
        try {
            if (settings.getPre_fetch_count() > 0) {
                current.basicQos(settings.getPre_fetch_count());
            }
            current.basicConsume(queue, false, consumerTag, false, false, null,
                    new StreamingConsumer(current, queue, stream));
        } catch (IOException | ShutdownSignalException e) {
            throw new ConsumeAttachException("Could not consume from queue " + queue + " as " + consumerTag, e);
        }
        return stream;
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
        channel.basicCancel(consumerTag);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        final Channel toClose;
        synchronized (this) {
            if (stopped) {
                log.infoWithParams("Already closed, doing nothing.");
                return;
            }
            stopped = true;
            toClose = channel;
        }
        stopSignal.onNext(true);
        redialSubscription.unsubscribe();
        if (toClose.isOpen()) {
            try {
                toClose.close();
            } catch (TimeoutException e) {
                throw new IOException("Timed out closing channel " + toClose.getChannelNumber(), e);
            } catch (ShutdownSignalException e) {
                log.debugWithParams("Channel was closed concurrently.", "channelNr", toClose.getChannelNumber());
            }
        }
        log.infoWithParams("Channel supervisor closed.", "channelNr", toClose.getChannelNumber());
    }

    Channel currentChannel() {
        return channel;
    }
}

package com.meltwater.rabbitkeeper;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.meltwater.rabbitkeeper.impl.ConsumerLoop;
import com.meltwater.rabbitkeeper.impl.RedialingChannelSupervisor;
import com.meltwater.rabbitkeeper.util.Logger;
import rx.Scheduler;
import rx.schedulers.Schedulers;
import rx.subjects.BehaviorSubject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a set of independent consumers on one {@link ChannelSupervisor}.
 *
 * <p>Handlers are registered with {@link #addHandler(String, String, MessageHandler)} before {@link #start()}.
 * Each registration gets its own thread which consumes the queue, re-attaches whenever the delivery stream
 * ends and keeps going when the handler throws. A message is acked when the handler returns normally and
 * rejected with requeue otherwise.</p>
 *
 * <p>Example usage:
 * <code><pre>
 * ConsumerSupervisor supervisor = ConsumerSupervisor.create(connection, new SupervisorSettings());
 * supervisor.addHandler("orders", "order-writer", message -> store(message.payload));
 * supervisor.start();
 * ...
 * supervisor.stop().get();
 * </pre></code></p>
 */
public class ConsumerSupervisor {

    private static final Logger log = new Logger(ConsumerSupervisor.class);

    private static final AtomicLong consumerCount = new AtomicLong();

    private final ChannelSupervisor channelSupervisor;
    private final SupervisorSettings settings;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final Scheduler scheduler;
    private final BehaviorSubject<Boolean> stopSignal = BehaviorSubject.create();

    private LifecycleState state = LifecycleState.IDLE;
    private CountDownLatch loopsDone = new CountDownLatch(0);
    private CompletableFuture<Void> stopped;

    public ConsumerSupervisor(ChannelSupervisor channelSupervisor, SupervisorSettings settings) {
        this(channelSupervisor, settings, Schedulers.io());
    }

    /**
     * @param scheduler runs the consume backoff timers and the attach calls of the consumer loops
     */
    public ConsumerSupervisor(ChannelSupervisor channelSupervisor, SupervisorSettings settings, Scheduler scheduler) {
        this.channelSupervisor = channelSupervisor;
        this.settings = settings;
        this.scheduler = scheduler;
    }

    /**
     * Creates a supervisor on a new {@link RedialingChannelSupervisor}.
     *
     * @throws IOException if the connection or the first channel can not be opened
     */
    public static ConsumerSupervisor create(BrokerConnection connection, SupervisorSettings settings) throws IOException {
        return new ConsumerSupervisor(new RedialingChannelSupervisor(connection, settings), settings);
    }

    /**
     * Registers a handler for a queue.
     *
     * @param label prefix of the consumer tag, does not need to be unique
     * @return the consumer tag, the label followed by a process wide sequence number
     * @throws IllegalStateException if the supervisor has already been started or stopped
     */
    public synchronized String addHandler(String queue, String label, MessageHandler handler) {
        if (state != LifecycleState.IDLE) {
            throw new IllegalStateException("Handlers can only be added before start, state is " + state);
        }
        String consumerTag = label + "-" + consumerCount.incrementAndGet();
        bindings.put(consumerTag, new Binding(queue, handler));
        log.debugWithParams("Added handler.", "queue", queue, "consumerTag", consumerTag);
        return consumerTag;
    }

    /**
     * Starts one consumer thread per registered handler. Does nothing unless the supervisor is idle.
     */
    public synchronized void start() {
        if (state != LifecycleState.IDLE) {
            log.infoWithParams("Ignoring start.", "state", state);
            return;
        }
        state = LifecycleState.RUNNING;
        loopsDone = new CountDownLatch(bindings.size());
        final CountDownLatch done = loopsDone;
        for (Map.Entry<String, Binding> entry : bindings.entrySet()) {
            String consumerTag = entry.getKey();
            Binding binding = entry.getValue();
            ConsumerLoop loop = new ConsumerLoop(
                    consumerTag,
                    binding.queue,
                    binding.handler,
                    channelSupervisor,
                    settings.getConsume_backoff(),
                    settings.getConsume_event_listener(),
                    this::isRunning,
                    stopSignal,
                    scheduler);
            Thread thread = new ThreadFactoryBuilder()
                    .setNameFormat("consumer-" + consumerTag.replace("%", "%%"))
                    .build()
                    .newThread(() -> {
                        try {
                            loop.run();
                        } finally {
                            done.countDown();
                        }
                    });
            thread.start();
        }
        log.infoWithParams("Consumer supervisor started.",
                "consumers", bindings.size(),
                "settings", settings);
    }

    /**
     * Stops all consumers. Deliveries are cancelled right away; the returned future completes once every
     * consumer thread has finished its current message and exited, and the channel has been closed. It
     * completes exceptionally if closing the channel fails.
     *
     * <p>Calling stop again returns the same future.</p>
     */
    public synchronized CompletableFuture<Void> stop() {
        if (stopped != null) {
            return stopped;
        }
        stopped = new CompletableFuture<>();
        if (state == LifecycleState.IDLE) {
            state = LifecycleState.STOPPING;
            finish();
            return stopped;
        }
        state = LifecycleState.STOPPING;
        stopSignal.onNext(true);
        final List<String> consumerTags = ImmutableList.copyOf(bindings.keySet());
        final CountDownLatch done = loopsDone;
        Thread coordinator = new ThreadFactoryBuilder()
                .setNameFormat("consumer-supervisor-stop-%d")
                .build()
                .newThread(() -> {
                    cancelAll(consumerTags);
                    try {
                        done.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        synchronized (ConsumerSupervisor.this) {
                            stopped.completeExceptionally(e);
                        }
                        return;
                    }
                    synchronized (ConsumerSupervisor.this) {
                        finish();
                    }
                });
        coordinator.start();
        return stopped;
    }

    // Must hold the lock.
    private void finish() {
        try {
            channelSupervisor.close();
            state = LifecycleState.STOPPED;
            log.infoWithParams("Consumer supervisor stopped.", "consumers", bindings.size());
            stopped.complete(null);
        } catch (IOException | RuntimeException e) {
            state = LifecycleState.STOPPED;
            log.errorWithParams("Failed to close channel when stopping.", e);
            stopped.completeExceptionally(e);
        }
    }

    private void cancelAll(List<String> consumerTags) {
        for (String consumerTag : consumerTags) {
            try {
                channelSupervisor.cancel(consumerTag);
            } catch (IOException | RuntimeException e) {
                log.warnWithParams("Failed to cancel consumer.",
                        "consumerTag", consumerTag,
                        "error", String.valueOf(e));
            }
        }
    }

    public synchronized LifecycleState getState() {
        return state;
    }

    public synchronized List<String> getConsumerTags() {
        return new ArrayList<>(bindings.keySet());
    }

    private synchronized boolean isRunning() {
        return state == LifecycleState.RUNNING;
    }

    private static class Binding {
        final String queue;
        final MessageHandler handler;

        Binding(String queue, MessageHandler handler) {
            this.queue = queue;
            this.handler = handler;
        }
    }
}

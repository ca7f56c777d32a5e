package com.meltwater.rabbitkeeper;

import com.meltwater.rabbitkeeper.util.BackoffAlgorithm;
import com.meltwater.rabbitkeeper.util.ConstantBackoffAlgorithm;

/**
 * Settings for the {@link ChannelSupervisor} and the {@link ConsumerSupervisor}.
 */
public class SupervisorSettings {

    public static final int DEFAULT_REDIAL_BACKOFF_MILLIS = 10_000;
    public static final int DEFAULT_CONSUME_BACKOFF_MILLIS = 15_000;
    public static final int UNLIMITED_PREFETCH = 0;

    private BackoffAlgorithm redial_backoff     = new ConstantBackoffAlgorithm(DEFAULT_REDIAL_BACKOFF_MILLIS);
    private BackoffAlgorithm consume_backoff    = new ConstantBackoffAlgorithm(DEFAULT_CONSUME_BACKOFF_MILLIS);
    private int pre_fetch_count                 = UNLIMITED_PREFETCH;
    private ConsumeEventListener consume_event_listener = new ConsumeEventListener() {};

    public BackoffAlgorithm getRedial_backoff() {
        return redial_backoff;
    }

    public BackoffAlgorithm getConsume_backoff() {
        return consume_backoff;
    }

    public int getPre_fetch_count() {
        return pre_fetch_count;
    }

    public ConsumeEventListener getConsume_event_listener() {
        return consume_event_listener;
    }

    /**
     * @param redial_backoff the wait between attempts to re-open a closed channel
     */
    public SupervisorSettings withRedialBackoff(BackoffAlgorithm redial_backoff) {
        this.redial_backoff = redial_backoff;
        return this;
    }

    /**
     * @param consume_backoff the wait before a consumer re-attaches after its stream ended or failed to start
     */
    public SupervisorSettings withConsumeBackoff(BackoffAlgorithm consume_backoff) {
        this.consume_backoff = consume_backoff;
        return this;
    }

    /**
     * @param pre_fetch_count the basic.qos prefetch applied before consuming, 0 leaves it unlimited
     */
    public SupervisorSettings withPreFetchCount(int pre_fetch_count) {
        if (pre_fetch_count < 0) {
            throw new IllegalArgumentException("pre_fetch_count must not be negative: " + pre_fetch_count);
        }
        this.pre_fetch_count = pre_fetch_count;
        return this;
    }

    public SupervisorSettings withConsumeEventListener(ConsumeEventListener consume_event_listener) {
        this.consume_event_listener = consume_event_listener;
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "redial_backoff:" + redial_backoff +
                ", consume_backoff:" + consume_backoff +
                ", pre_fetch_count:" + pre_fetch_count +
                '}';
    }
}

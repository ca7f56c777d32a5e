package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.util.BackoffAlgorithm;
import com.meltwater.rabbitkeeper.util.Logger;
import rx.Observable;
import rx.Scheduler;
import rx.functions.Func1;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Used with {@link Observable#retryWhen(Func1)} to re-subscribe to a failed operation after the backoff delay.
 * There is no attempt limit; retrying ends only when the subscription is cancelled or the returned
 * notification stream is completed by the caller.
 */
public class BackoffRetryHandler implements Func1<Observable<? extends Throwable>, Observable<?>> {

    private static final Logger log = new Logger(BackoffRetryHandler.class);

    private final AtomicInteger attempt = new AtomicInteger();
    private final String operation;
    private final BackoffAlgorithm backoffAlgorithm;
    private final Scheduler scheduler;

    /**
     * @param operation what is being retried, only used for logging
     */
    public BackoffRetryHandler(String operation, BackoffAlgorithm backoffAlgorithm, Scheduler scheduler) {
        this.operation = operation;
        this.backoffAlgorithm = backoffAlgorithm;
        this.scheduler = scheduler;
    }

    @Override
    public Observable<?> call(Observable<? extends Throwable> errors) {
        return errors.flatMap(throwable -> {
            final int failedAttempt = attempt.getAndIncrement();
            final int delayMs = backoffAlgorithm.getDelayMs(failedAttempt);
            log.warnWithParams("Operation failed, scheduling another attempt.",
                    "operation", operation,
                    "attempt", failedAttempt + 1,
                    "delayMs", delayMs,
                    "error", String.valueOf(throwable));
            return Observable.timer(delayMs, TimeUnit.MILLISECONDS, scheduler);
        });
    }

    public int getAttempts() {
        return attempt.get();
    }
}

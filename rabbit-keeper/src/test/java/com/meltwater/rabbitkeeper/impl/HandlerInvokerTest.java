package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.Acknowledger;
import com.meltwater.rabbitkeeper.Message;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.mockito.Mockito.mock;

public class HandlerInvokerTest {

    private final Message message = new Message("orders-1",
            new Envelope(7L, false, "events", "order.created"),
            new AMQP.BasicProperties(),
            "hello".getBytes(StandardCharsets.UTF_8),
            mock(Acknowledger.class));

    @Test
    public void returning_normally_is_ok() {
        AtomicReference<Message> seen = new AtomicReference<>();
        HandlerOutcome outcome = HandlerInvoker.invoke(seen::set, message);
        assertThat(outcome.getKind(), is(HandlerOutcome.Kind.OK));
        assertThat(outcome.isOk(), is(true));
        assertThat(outcome.getCause(), nullValue());
        assertThat(seen.get(), sameInstance(message));
    }

    @Test
    public void checked_exception_is_a_failure() {
        IOException error = new IOException("database down");
        HandlerOutcome outcome = HandlerInvoker.invoke(m -> {
            throw error;
        }, message);
        assertThat(outcome.getKind(), is(HandlerOutcome.Kind.FAILED));
        assertThat(outcome.isOk(), is(false));
        assertThat(outcome.getCause(), sameInstance((Throwable) error));
    }

    @Test
    public void runtime_exception_is_a_crash() {
        HandlerOutcome outcome = HandlerInvoker.invoke(m -> {
            throw new NullPointerException("no customer");
        }, message);
        assertThat(outcome.getKind(), is(HandlerOutcome.Kind.CRASHED));
        assertThat(outcome.getCause(), instanceOf(NullPointerException.class));
    }

    @Test
    public void error_is_a_crash() {
        HandlerOutcome outcome = HandlerInvoker.invoke(m -> {
            throw new StackOverflowError();
        }, message);
        assertThat(outcome.getKind(), is(HandlerOutcome.Kind.CRASHED));
        assertThat(outcome.getCause(), instanceOf(StackOverflowError.class));
    }

    @Test
    public void crash_with_huge_stack_trace_is_contained() {
        HandlerOutcome outcome = HandlerInvoker.invoke(m -> deepThrow(3_000), message);
        assertThat(outcome.getKind(), is(HandlerOutcome.Kind.CRASHED));
        assertThat(outcome.toString(), equalTo("CRASHED(java.lang.IllegalStateException: too deep)"));
    }

    private static void deepThrow(int depth) {
        if (depth == 0) {
            throw new IllegalStateException("too deep");
        }
        deepThrow(depth - 1);
    }
}

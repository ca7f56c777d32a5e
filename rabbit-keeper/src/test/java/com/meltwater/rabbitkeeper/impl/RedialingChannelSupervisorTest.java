package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.BrokerConnection;
import com.meltwater.rabbitkeeper.ChannelOpenException;
import com.meltwater.rabbitkeeper.ConnectionException;
import com.meltwater.rabbitkeeper.ConsumeAttachException;
import com.meltwater.rabbitkeeper.DeliveryStream;
import com.meltwater.rabbitkeeper.SupervisorSettings;
import com.meltwater.rabbitkeeper.util.ConstantBackoffAlgorithm;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.mockito.ArgumentCaptor;
import rx.schedulers.TestScheduler;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RedialingChannelSupervisorTest {

    private static final int REDIAL_BACKOFF = 10_000;

    @Rule
    public Timeout globalTimeout = new Timeout(10, TimeUnit.SECONDS);

    private final TestScheduler scheduler = new TestScheduler();
    private final SupervisorSettings settings = new SupervisorSettings()
            .withRedialBackoff(new ConstantBackoffAlgorithm(REDIAL_BACKOFF));

    private BrokerConnection connection;
    private Channel first;
    private Channel second;

    @Before
    public void setup() {
        connection = mock(BrokerConnection.class);
        first = mockChannel(1);
        second = mockChannel(2);
    }

    @Test
    public void opens_channel_on_construction() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        assertThat(supervisor.currentChannel(), sameInstance(first));
        verify(first).addShutdownListener(any(ShutdownListener.class));
    }

    @Test
    public void construction_fails_when_connection_is_down() throws Exception {
        ConnectionException down = new ConnectionException("refused", new IOException("refused"));
        when(connection.openChannel()).thenThrow(down);
        try {
            new RedialingChannelSupervisor(connection, settings, scheduler);
            fail("expected ConnectionException");
        } catch (ConnectionException e) {
            assertThat(e, sameInstance(down));
        }
    }

    @Test
    public void redials_after_unexpected_shutdown() throws Exception {
        when(connection.openChannel()).thenReturn(first, second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        ShutdownListener listener = listenerOf(first);
        listener.shutdownCompleted(brokerClosed(first));
        assertThat(supervisor.currentChannel(), sameInstance(first));

        scheduler.triggerActions();

        assertThat(supervisor.currentChannel(), sameInstance(second));
        verify(first).removeShutdownListener(listener);
        verify(first, never()).close();
        verify(second).addShutdownListener(any(ShutdownListener.class));
    }

    @Test
    public void closes_stale_channel_that_is_still_open() throws Exception {
        when(connection.openChannel()).thenReturn(first, second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        when(first.isOpen()).thenReturn(true);

        listenerOf(first).shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();

        verify(first).close();
        assertThat(supervisor.currentChannel(), sameInstance(second));
    }

    @Test
    public void retries_failed_redial_after_backoff() throws Exception {
        when(connection.openChannel())
                .thenReturn(first)
                .thenThrow(new ChannelOpenException("channel_max reached"))
                .thenThrow(new ConnectionException("refused", null))
                .thenReturn(second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        listenerOf(first).shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();
        assertThat(supervisor.currentChannel(), sameInstance(first));

        scheduler.advanceTimeBy(REDIAL_BACKOFF - 1, TimeUnit.MILLISECONDS);
        verify(connection, times(2)).openChannel();

        scheduler.advanceTimeBy(1, TimeUnit.MILLISECONDS);
        verify(connection, times(3)).openChannel();
        assertThat(supervisor.currentChannel(), sameInstance(first));

        scheduler.advanceTimeBy(REDIAL_BACKOFF, TimeUnit.MILLISECONDS);
        verify(connection, times(4)).openChannel();
        assertThat(supervisor.currentChannel(), sameInstance(second));
    }

    @Test
    public void ignores_application_initiated_shutdown() throws Exception {
        when(connection.openChannel()).thenReturn(first, second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        listenerOf(first).shutdownCompleted(new ShutdownSignalException(false, true, null, first));
        scheduler.triggerActions();

        verify(connection, times(1)).openChannel();
        assertThat(supervisor.currentChannel(), sameInstance(first));
    }

    @Test
    public void ignores_shutdown_of_replaced_channel() throws Exception {
        Channel third = mockChannel(3);
        when(connection.openChannel()).thenReturn(first, second, third);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        ShutdownListener firstListener = listenerOf(first);
        firstListener.shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();

        firstListener.shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();

        verify(connection, times(2)).openChannel();
        assertThat(supervisor.currentChannel(), sameInstance(second));
    }

    @Test
    public void close_stops_pending_redial() throws Exception {
        when(connection.openChannel())
                .thenReturn(first)
                .thenThrow(new ChannelOpenException("no channel"));
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        listenerOf(first).shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();
        verify(connection, times(2)).openChannel();

        supervisor.close();
        scheduler.advanceTimeBy(10 * REDIAL_BACKOFF, TimeUnit.MILLISECONDS);

        verify(connection, times(2)).openChannel();
    }

    @Test
    public void close_is_idempotent() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        when(first.isOpen()).thenReturn(true);

        supervisor.close();
        supervisor.close();

        verify(first, times(1)).close();
    }

    @Test
    public void shutdown_after_close_is_not_redialed() throws Exception {
        when(connection.openChannel()).thenReturn(first, second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        supervisor.close();
        listenerOf(first).shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();

        verify(connection, times(1)).openChannel();
    }

    @Test
    public void declares_durable_topology() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        supervisor.exchangeDeclare("events", "topic");
        supervisor.queueDeclare("orders");
        supervisor.queueBind("orders", "order.*", "events");

        verify(first).exchangeDeclare("events", "topic", true, false, false, null);
        verify(first).queueDeclare("orders", true, false, false, null);
        verify(first).queueBind("orders", "events", "order.*");
    }

    @Test
    public void redeclaring_topology_uses_the_same_arguments() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);

        for (int i = 0; i < 2; i++) {
            supervisor.exchangeDeclare("events", "topic");
            supervisor.queueDeclare("orders");
            supervisor.queueBind("orders", "order.*", "events");
        }

        verify(first, times(2)).exchangeDeclare("events", "topic", true, false, false, null);
        verify(first, times(2)).queueDeclare("orders", true, false, false, null);
        verify(first, times(2)).queueBind("orders", "events", "order.*");
        verify(first, never()).exchangeDeclare(anyString(), anyString(), eq(false), anyBoolean(), anyBoolean(), any());
        verify(first, never()).queueDeclare(anyString(), eq(false), anyBoolean(), anyBoolean(), any());
    }

    @Test
    public void publishes_plain_text() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        byte[] body = "hello".getBytes();

        supervisor.publish("events", "order.created", body);

        verify(first).basicPublish(eq("events"), eq("order.created"), eq(false), eq(false),
                argThat(props -> "text/plain".equals(props.getContentType())), eq(body));
    }

    @Test
    public void consumes_with_manual_ack_and_prefetch() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings.withPreFetchCount(5), scheduler);

        DeliveryStream stream = supervisor.consume("orders", "orders-1");

        assertThat(stream.getConsumerTag(), equalTo("orders-1"));
        verify(first).basicQos(5);
        verify(first).basicConsume(eq("orders"), eq(false), eq("orders-1"), eq(false), eq(false), isNull(),
                any(StreamingConsumer.class));
    }

    @Test
    public void consumes_after_redial_on_new_channel() throws Exception {
        when(connection.openChannel()).thenReturn(first, second);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        listenerOf(first).shutdownCompleted(brokerClosed(first));
        scheduler.triggerActions();

        supervisor.consume("orders", "orders-1");

        verify(first, never()).basicConsume(anyString(), eq(false), anyString(), eq(false), eq(false), isNull(),
                any(Consumer.class));
        verify(second).basicConsume(eq("orders"), eq(false), eq("orders-1"), eq(false), eq(false), isNull(),
                any(Consumer.class));
    }

    @Test
    public void wraps_consume_failure() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        when(first.basicConsume(anyString(), eq(false), anyString(), eq(false), eq(false), isNull(), any(Consumer.class)))
                .thenThrow(new IOException("no queue 'orders'"));
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        try {
            supervisor.consume("orders", "orders-1");
            fail("expected ConsumeAttachException");
        } catch (ConsumeAttachException e) {
            assertThat(e.getCause(), instanceOf(IOException.class));
        }
    }

    @Test
    public void cancels_on_current_channel() throws Exception {
        when(connection.openChannel()).thenReturn(first);
        RedialingChannelSupervisor supervisor = new RedialingChannelSupervisor(connection, settings, scheduler);
        when(first.isOpen()).thenReturn(true);

        supervisor.cancel("orders-1");

        verify(first).basicCancel("orders-1");
        assertThat(supervisor.isOpen(), is(true));
    }

    private static Channel mockChannel(int number) {
        Channel channel = mock(Channel.class);
        when(channel.getChannelNumber()).thenReturn(number);
        return channel;
    }

    private static ShutdownListener listenerOf(Channel channel) {
        ArgumentCaptor<ShutdownListener> captor = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(channel).addShutdownListener(captor.capture());
        return captor.getValue();
    }

    private static ShutdownSignalException brokerClosed(Channel channel) {
        return new ShutdownSignalException(false, false, null, channel);
    }
}

package com.meltwater.rabbitkeeper;

import com.meltwater.rabbitkeeper.util.Logger;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.io.Closeable;
import java.io.IOException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * A handle to one broker connection, shared by any number of {@link ChannelSupervisor}s.
 *
 * The connection is opened lazily and re-opened whenever it is found closed. Supervisors only ever
 * close their own channels; the connection is closed by whoever created this handle.
 */
public class BrokerConnection implements Closeable {

    private static final Logger log = new Logger(BrokerConnection.class);

    private final BrokerAddress address;
    private final ConnectionSettings settings;
    private final ConnectionFactory connectionFactory;

    private Connection connection;
    private boolean closed = false;

    public BrokerConnection(BrokerAddress address, ConnectionSettings settings) {
        this(address, settings, new ConnectionFactory());
    }

    BrokerConnection(BrokerAddress address, ConnectionSettings settings, ConnectionFactory connectionFactory) {
        this.address = address;
        this.settings = settings;
        this.connectionFactory = connectionFactory;
        configure(connectionFactory);
    }

    private void configure(ConnectionFactory cf) {
        cf.setHost(address.host);
        cf.setPort(address.effectivePort());
        cf.setUsername(address.username);
        cf.setPassword(address.password);
        cf.setVirtualHost(address.virtualHost);
        cf.setRequestedHeartbeat(settings.getHeartbeat());
        cf.setConnectionTimeout(settings.getConnection_timeout_millis());
        cf.setShutdownTimeout(settings.getShutdown_timeout_millis());
        cf.setHandshakeTimeout(settings.getHandshake_timeout_millis());
        //channels are re-opened by the supervisors, the client must not recover on its own
        cf.setAutomaticRecoveryEnabled(false);
        cf.setTopologyRecoveryEnabled(false);
        if (address.tls) {
            try {
                cf.useSslProtocol();
            } catch (NoSuchAlgorithmException | KeyManagementException e) {
                throw new IllegalArgumentException("Could not enable tls for " + address, e);
            }
        }
    }

    /**
     * Returns the live connection, connecting first if there is none or the previous one was closed.
     *
     * @throws ConnectionException if connecting fails or this handle has been closed
     */
    public synchronized Connection ensureOpen() throws ConnectionException {
        if (closed) {
            throw new ConnectionException("Broker connection to " + address + " has been closed", null);
        }
        if (connection != null) {
            if (connection.isOpen()) {
                return connection;
            }
            log.infoWithParams("Found closed broker connection, re-connecting.",
                    "address", address,
                    "closeReason", connection.getCloseReason());
            connection.abort();
            connection = null;
        }
        DateTime connectTime = new DateTime(DateTimeZone.UTC);
        Map<String, Object> clientProperties = new HashMap<>(settings.getClient_properties());
        clientProperties.put("connection_name", settings.getConnection_name());
        clientProperties.put("connect_time", connectTime.toString());
        connectionFactory.setClientProperties(clientProperties);
        try {
            connection = connectionFactory.newConnection(settings.getConnection_name());
        } catch (IOException | TimeoutException e) {
            throw new ConnectionException("Could not connect to broker at " + address, e);
        }
        connection.addShutdownListener(cause -> {
            if (!cause.isInitiatedByApplication()) {
                log.warnWithParams("Broker connection closed unexpectedly.",
                        "address", address,
                        "connectTime", connectTime.toString(),
                        "reason", cause.getMessage());
            }
        });
        log.infoWithParams("Successfully created connection to broker.",
                "address", address,
                "name", settings.getConnection_name(),
                "connectTime", connectTime.toString(),
                "settings", settings);
        return connection;
    }

    public synchronized boolean isOpen() {
        return connection != null && connection.isOpen();
    }

    /**
     * Opens a new channel on the live connection, connecting first when needed.
     *
     * @throws ConnectionException if the connection can not be established
     * @throws ChannelOpenException if the channel can not be opened
     */
    public Channel openChannel() throws ConnectionException, ChannelOpenException {
        Connection live = ensureOpen();
        Channel channel;
        try {
            channel = live.createChannel();
        } catch (IOException | ShutdownSignalException e) {
            throw new ChannelOpenException("Could not open channel on " + address, e);
        }
        if (channel == null) {
            throw new ChannelOpenException("No free channel number on " + address + ", channel_max reached");
        }
        return channel;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (connection != null && connection.isOpen()) {
            connection.close();
            log.infoWithParams("Closed broker connection.", "address", address);
        }
        connection = null;
    }
}

package com.meltwater.rabbitkeeper;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Settings used to configure the {@link com.rabbitmq.client.ConnectionFactory} behind a {@link BrokerConnection}.
 *
 * @see <a href="https://www.rabbitmq.com/uri-query-parameters.html">AMQP uri-query-parameters</a>
 */
public class ConnectionSettings {

    public static final int DEFAULT_HEARTBEAT = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT = 30_000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT = 10_000;
    public static final int DEFAULT_HANDSHAKE_MILLIS = 10_000;
    public static final String DEFAULT_CONNECTION_NAME = "rabbit-keeper";

    private int heartbeat                   = DEFAULT_HEARTBEAT; //in seconds
    private int connection_timeout_millis   = DEFAULT_CONNECTION_TIMEOUT;
    private int shutdown_timeout_millis     = DEFAULT_SHUTDOWN_TIMEOUT;
    private int handshake_timeout_millis    = DEFAULT_HANDSHAKE_MILLIS;
    private String connection_name          = DEFAULT_CONNECTION_NAME;

    private Map<String,String> client_properties = ImmutableMap.of();

    public int getHeartbeat() {
        return heartbeat;
    }

    public int getConnection_timeout_millis() {
        return connection_timeout_millis;
    }

    public int getShutdown_timeout_millis() {
        return shutdown_timeout_millis;
    }

    public int getHandshake_timeout_millis() {
        return handshake_timeout_millis;
    }

    public String getConnection_name() {
        return connection_name;
    }

    public Map<String, String> getClient_properties() {
        return client_properties;
    }

    public ConnectionSettings withHeartbeatSecs(int heartbeat) {
        this.heartbeat = requireNonNegative(heartbeat, "heartbeat");
        return this;
    }

    public ConnectionSettings withConnectionTimeoutMillis(int connection_timeout_millis) {
        this.connection_timeout_millis = requireNonNegative(connection_timeout_millis, "connection_timeout_millis");
        return this;
    }

    public ConnectionSettings withShutdownTimeoutMillis(int shutdown_timeout_millis) {
        this.shutdown_timeout_millis = requireNonNegative(shutdown_timeout_millis, "shutdown_timeout_millis");
        return this;
    }

    public ConnectionSettings withHandshakeTimeoutMillis(int handshake_timeout_millis) {
        this.handshake_timeout_millis = requireNonNegative(handshake_timeout_millis, "handshake_timeout_millis");
        return this;
    }

    public ConnectionSettings withConnectionName(String connection_name) {
        this.connection_name = connection_name;
        return this;
    }

    public ConnectionSettings withClientProperties(Map<String, String> client_properties) {
        this.client_properties = ImmutableMap.copyOf(client_properties);
        return this;
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "{" +
                "heartbeat:" + heartbeat +
                ", connection_timeout_millis:" + connection_timeout_millis +
                ", shutdown_timeout_millis:" + shutdown_timeout_millis +
                ", handshake_timeout_millis:" + handshake_timeout_millis +
                ", connection_name:'" + connection_name + "'" +
                ", client_properties:{" + Joiner.on(", ").withKeyValueSeparator(":").join(client_properties) + "}" +
                '}';
    }
}

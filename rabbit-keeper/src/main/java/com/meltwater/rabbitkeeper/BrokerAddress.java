package com.meltwater.rabbitkeeper;

import com.rabbitmq.client.ConnectionFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;

import static com.rabbitmq.client.ConnectionFactory.DEFAULT_AMQP_OVER_SSL_PORT;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_AMQP_PORT;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_HOST;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_PASS;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_USER;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_VHOST;
import static com.rabbitmq.client.ConnectionFactory.USE_DEFAULT_PORT;

/**
 * Where and how to reach the broker: host, port, credentials, virtual host and whether TLS is used.
 *
 * @see <a href="https://www.rabbitmq.com/uri-spec.html">AMQP URI spec</a>
 */
public class BrokerAddress {

    public final String username;
    public final String password;
    public final String virtualHost;
    public final String host;
    public final int port;
    public final boolean tls;

    private BrokerAddress(String username, String password, String virtualHost, String host, int port, boolean tls) {
        this.username = username;
        this.password = password;
        this.virtualHost = virtualHost;
        this.host = host;
        this.port = port;
        this.tls = tls;
    }

    /**
     * @return the port to connect to, resolving {@link ConnectionFactory#USE_DEFAULT_PORT} by the tls flag
     */
    public int effectivePort() {
        if (port != USE_DEFAULT_PORT) {
            return port;
        }
        return tls ? DEFAULT_AMQP_OVER_SSL_PORT : DEFAULT_AMQP_PORT;
    }

    @Override
    public String toString() {
        return (tls ? "amqps" : "amqp") + "://" + host + ":" + effectivePort() + "/" + (virtualHost.equals("/") ? "" : virtualHost);
    }

    public static class Builder {

        private String username     = DEFAULT_USER;
        private String password     = DEFAULT_PASS;
        private String virtualHost  = DEFAULT_VHOST;
        private String host         = DEFAULT_HOST;
        private int port            = USE_DEFAULT_PORT;
        private boolean tls         = false;

        public BrokerAddress build() {
            return new BrokerAddress(username, password, virtualHost, host, port, tls);
        }

        /**
         * Copies all values from an amqp:// or amqps:// uri. The amqps scheme turns on tls.
         */
        public Builder withUri(String amqpUri) {
            try {
                ConnectionFactory tmp = new ConnectionFactory();
                tmp.setUri(amqpUri);
                username = tmp.getUsername();
                password = tmp.getPassword();
                virtualHost = tmp.getVirtualHost();
                host = tmp.getHost();
                port = tmp.getPort();
                tls = "amqps".equalsIgnoreCase(new URI(amqpUri).getScheme());
                return this;
            } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException e) {
                throw new IllegalArgumentException("Invalid broker uri " + amqpUri, e);
            }
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withTls(boolean tls) {
            this.tls = tls;
            return this;
        }
    }
}

package com.meltwater.rabbitkeeper.example;

import com.google.common.base.Charsets;
import com.meltwater.rabbitkeeper.BrokerAddress;
import com.meltwater.rabbitkeeper.BrokerConnection;
import com.meltwater.rabbitkeeper.ChannelSupervisor;
import com.meltwater.rabbitkeeper.ConnectionSettings;
import com.meltwater.rabbitkeeper.ConsumerSupervisor;
import com.meltwater.rabbitkeeper.Message;
import com.meltwater.rabbitkeeper.SupervisorSettings;
import com.meltwater.rabbitkeeper.impl.RedialingChannelSupervisor;
import com.meltwater.rabbitkeeper.util.Logger;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

/**
 * An example app which consumes two queues with a {@link ConsumerSupervisor} and keeps going through
 * broker restarts.
 */
public class ExampleApp {

    private static final Logger log = new Logger(ExampleApp.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = AppConfig.from(loadProperties());
        BrokerConnection connection = new BrokerConnection(
                new BrokerAddress.Builder().withUri(config.brokerUri).build(),
                new ConnectionSettings().withConnectionName("example-app"));

        ChannelSupervisor topology = new RedialingChannelSupervisor(connection, new SupervisorSettings());
        declareTopology(topology, config);

        final ExampleApp app = new ExampleApp(
                ConsumerSupervisor.create(connection, new SupervisorSettings().withPreFetchCount(config.preFetchCount)),
                config);
        app.start();

        //On shutdown call stop
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            try {
                app.stop();
                topology.close();
                connection.close();
            } catch (Exception e) {
                log.errorWithParams("Failed to shut down cleanly.", e);
            }
        }));

        //Wait for Ctrl+C
        while (true) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                break;
            }
        }
    }

    static Properties loadProperties() throws IOException {
        Properties prop = new Properties();
        prop.load(ExampleApp.class.getResourceAsStream("/example_app.properties"));
        prop.putAll(System.getProperties());
        return prop;
    }

    /**
     * Declares the exchange and both queues and binds them. Safe to run on every start.
     */
    static void declareTopology(ChannelSupervisor channel, AppConfig config) throws IOException {
        channel.exchangeDeclare(config.exchange, "topic");
        channel.queueDeclare(config.ordersQueue);
        channel.queueDeclare(config.eventsQueue);
        channel.queueBind(config.ordersQueue, config.ordersRoutingKey, config.exchange);
        channel.queueBind(config.eventsQueue, config.eventsRoutingKey, config.exchange);
        log.infoWithParams("Declared topology.", "config", config);
    }

    private final ConsumerSupervisor consumers;

    public ExampleApp(ConsumerSupervisor consumers, AppConfig config) {
        this.consumers = consumers;
        consumers.addHandler(config.ordersQueue, "orders", this::handleOrder);
        consumers.addHandler(config.eventsQueue, "events", this::handleEvent);
    }

    void handleOrder(Message message) {
        //change in logback.xml to DEBUG level to see every message payload logged
        log.debugWithParams("Received order.",
                "payload", new String(message.payload, Charsets.UTF_8),
                "routingKey", message.envelope.getRoutingKey());
    }

    void handleEvent(Message message) throws IOException {
        String payload = new String(message.payload, Charsets.UTF_8);
        if (payload.isEmpty()) {
            throw new IOException("Empty event, delivery tag " + message.envelope.getDeliveryTag());
        }
        log.debugWithParams("Received event.",
                "payload", payload,
                "routingKey", message.envelope.getRoutingKey());
    }

    void start() {
        consumers.start();
    }

    void stop() throws InterruptedException, ExecutionException {
        consumers.stop().get();
    }
}

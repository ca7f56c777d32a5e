package com.meltwater.rabbitkeeper.example;

import com.google.common.base.Charsets;
import com.meltwater.rabbitkeeper.BrokerAddress;
import com.meltwater.rabbitkeeper.BrokerConnection;
import com.meltwater.rabbitkeeper.ChannelSupervisor;
import com.meltwater.rabbitkeeper.ConnectionSettings;
import com.meltwater.rabbitkeeper.SupervisorSettings;
import com.meltwater.rabbitkeeper.impl.RedialingChannelSupervisor;
import com.meltwater.rabbitkeeper.util.Logger;

import java.io.IOException;

public class LoadGenerator {

    private static final Logger log = new Logger(LoadGenerator.class);

    public static void main(String[] args) throws IOException {
        AppConfig config = AppConfig.from(ExampleApp.loadProperties());
        try (BrokerConnection connection = new BrokerConnection(
                new BrokerAddress.Builder().withUri(config.brokerUri).build(),
                new ConnectionSettings().withConnectionName("load-generator"))) {
            ChannelSupervisor channel = new RedialingChannelSupervisor(connection, new SupervisorSettings());
            try {
                ExampleApp.declareTopology(channel, config);
                publishTestMessages(channel, config.exchange, config.ordersRoutingKey, config.publishCount);
                publishTestMessages(channel, config.exchange, config.eventsRoutingKey, config.publishCount);
            } finally {
                channel.close();
            }
        }
    }

    /**
     * Publishes numbered text messages, stopping at the first failed publish.
     *
     * @return the number of messages published
     */
    public static long publishTestMessages(ChannelSupervisor channel, String exchange, String routingKey, long nrToPublish) throws IOException {
        log.infoWithParams("Publishing messages to exchange.",
                "numToPublish", nrToPublish,
                "exchange", exchange,
                "routingKey", routingKey);

        for (long id = 1; id <= nrToPublish; id++) {
            String msgPayload = "Message nr " + id;
            channel.publish(exchange, routingKey, msgPayload.getBytes(Charsets.UTF_8));
        }

        log.infoWithParams("All messages sent to exchange.",
                "numSent", nrToPublish,
                "exchange", exchange);
        return nrToPublish;
    }
}

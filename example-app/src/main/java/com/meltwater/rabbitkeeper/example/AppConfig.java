package com.meltwater.rabbitkeeper.example;

import java.util.Properties;

/**
 * The settings of the example apps, read from a properties file with system properties layered on top.
 */
public class AppConfig {

    public final String brokerUri;
    public final String exchange;
    public final String ordersQueue;
    public final String ordersRoutingKey;
    public final String eventsQueue;
    public final String eventsRoutingKey;
    public final int preFetchCount;
    public final long publishCount;

    AppConfig(String brokerUri,
              String exchange,
              String ordersQueue,
              String ordersRoutingKey,
              String eventsQueue,
              String eventsRoutingKey,
              int preFetchCount,
              long publishCount) {
        this.brokerUri = brokerUri;
        this.exchange = exchange;
        this.ordersQueue = ordersQueue;
        this.ordersRoutingKey = ordersRoutingKey;
        this.eventsQueue = eventsQueue;
        this.eventsRoutingKey = eventsRoutingKey;
        this.preFetchCount = preFetchCount;
        this.publishCount = publishCount;
    }

    /**
     * @throws IllegalArgumentException if a property is missing or a number can not be parsed
     */
    public static AppConfig from(Properties prop) {
        return new AppConfig(
                required(prop, "rabbit.broker.uri"),
                required(prop, "rabbit.exchange"),
                required(prop, "rabbit.orders.queue"),
                required(prop, "rabbit.orders.routing.key"),
                required(prop, "rabbit.events.queue"),
                required(prop, "rabbit.events.routing.key"),
                (int) number(prop, "rabbit.prefetch.count"),
                number(prop, "publish.message.count"));
    }

    private static String required(Properties prop, String key) {
        String value = prop.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing property " + key);
        }
        return value.trim();
    }

    private static long number(Properties prop, String key) {
        String value = required(prop, key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "{" +
                "exchange:'" + exchange + "'" +
                ", ordersQueue:'" + ordersQueue + "'" +
                ", eventsQueue:'" + eventsQueue + "'" +
                ", preFetchCount:" + preFetchCount +
                ", publishCount:" + publishCount +
                '}';
    }
}

package com.meltwater.rabbitkeeper;

import java.io.IOException;

/**
 * Thrown when a channel can not be opened on a live connection.
 */
public class ChannelOpenException extends IOException {

    public ChannelOpenException(String message) {
        super(message);
    }

    public ChannelOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}

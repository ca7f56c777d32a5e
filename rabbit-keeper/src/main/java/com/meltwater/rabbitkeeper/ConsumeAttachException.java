package com.meltwater.rabbitkeeper;

import java.io.IOException;

/**
 * Thrown when a consumer can not be attached to a queue on the current channel.
 */
public class ConsumeAttachException extends IOException {

    public ConsumeAttachException(String message, Throwable cause) {
        super(message, cause);
    }
}

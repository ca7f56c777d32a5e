package com.meltwater.rabbitkeeper;

import java.io.IOException;

/**
 * Thrown when the shared broker connection can not be established or re-established.
 */
public class ConnectionException extends IOException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

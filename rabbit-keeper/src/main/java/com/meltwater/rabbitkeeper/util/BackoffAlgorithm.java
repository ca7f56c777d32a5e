package com.meltwater.rabbitkeeper.util;

/**
 * Decides how long to wait before the next attempt of a failing operation.
 */
public interface BackoffAlgorithm {

    /**
     * @param attempt the zero based number of the attempt that just failed
     * @return the delay in milliseconds before the next attempt
     */
    int getDelayMs(int attempt);
}

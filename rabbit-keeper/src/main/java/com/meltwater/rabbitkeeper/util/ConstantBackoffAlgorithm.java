package com.meltwater.rabbitkeeper.util;

public class ConstantBackoffAlgorithm implements BackoffAlgorithm {
    private final int backoffMs;

    public ConstantBackoffAlgorithm(int backoffMs) {
        if (backoffMs < 0) {
            throw new IllegalArgumentException("backoffMs must not be negative: " + backoffMs);
        }
        this.backoffMs = backoffMs;
    }

    @Override
    public int getDelayMs(int attempt) {
        return backoffMs;
    }

    @Override
    public String toString() {
        return "constant(" + backoffMs + "ms)";
    }
}

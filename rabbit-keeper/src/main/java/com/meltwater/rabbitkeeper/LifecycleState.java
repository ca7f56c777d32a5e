package com.meltwater.rabbitkeeper;

/**
 * Lifecycle of a {@link ConsumerSupervisor}. Transitions only go forward: IDLE, RUNNING, STOPPING, STOPPED.
 */
public enum LifecycleState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}

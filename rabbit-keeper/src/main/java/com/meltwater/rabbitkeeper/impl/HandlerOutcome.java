package com.meltwater.rabbitkeeper.impl;

/**
 * The result of running a {@link com.meltwater.rabbitkeeper.MessageHandler} once.
 */
public final class HandlerOutcome {

    public enum Kind {
        /** The handler returned normally. */
        OK,
        /** The handler threw a checked exception. */
        FAILED,
        /** The handler threw an unchecked exception or an error. */
        CRASHED
    }

    private static final HandlerOutcome OK = new HandlerOutcome(Kind.OK, null);

    private final Kind kind;
    private final Throwable cause;

    private HandlerOutcome(Kind kind, Throwable cause) {
        this.kind = kind;
        this.cause = cause;
    }

    public static HandlerOutcome ok() {
        return OK;
    }

    public static HandlerOutcome failed(Exception cause) {
        return new HandlerOutcome(Kind.FAILED, cause);
    }

    public static HandlerOutcome crashed(Throwable cause) {
        return new HandlerOutcome(Kind.CRASHED, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    /**
     * @return what the handler threw, null when the outcome is {@link Kind#OK}
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return cause == null ? kind.toString() : kind + "(" + cause + ")";
    }
}

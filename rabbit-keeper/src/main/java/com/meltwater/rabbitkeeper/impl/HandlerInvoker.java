package com.meltwater.rabbitkeeper.impl;

import com.meltwater.rabbitkeeper.Message;
import com.meltwater.rabbitkeeper.MessageHandler;
import com.meltwater.rabbitkeeper.util.Logger;
import com.meltwater.rabbitkeeper.util.StackTraces;

/**
 * Runs a {@link MessageHandler} so that nothing it throws can reach the consumer loop.
 */
public final class HandlerInvoker {

    private static final Logger log = new Logger(HandlerInvoker.class);

    private HandlerInvoker() {}

    public static HandlerOutcome invoke(MessageHandler handler, Message message) {
        try {
            handler.handle(message);
            return HandlerOutcome.ok();
        } catch (RuntimeException | Error crash) {
            log.errorWithParams("Handler crashed while processing message. The message will be requeued.",
                    "message", message,
                    "error", crash.toString(),
                    "stackTrace", StackTraces.capture(crash));
            return HandlerOutcome.crashed(crash);
        } catch (Exception e) {
            log.warnWithParams("Handler failed to process message. The message will be requeued.",
                    "message", message,
                    "error", e.toString());
            return HandlerOutcome.failed(e);
        }
    }
}

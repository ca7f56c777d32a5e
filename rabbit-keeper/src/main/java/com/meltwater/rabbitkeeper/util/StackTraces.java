package com.meltwater.rabbitkeeper.util;

import java.io.PrintWriter;
import java.io.StringWriter;

public class StackTraces {

    /**
     * Largest stack trace that is kept when a handler crash is logged: 65536 UTF-16 characters, not bytes.
     */
    public static final int MAX_STACK_TRACE_SIZE = 64 << 10;

    private StackTraces() {}

    /**
     * Renders the full stack trace of the throwable, including causes, and cuts it at
     * {@code maxSize} characters.
     */
    public static String capture(Throwable throwable, int maxSize) {
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            throwable.printStackTrace(writer);
        }
        String trace = out.toString();
        return trace.length() <= maxSize ? trace : trace.substring(0, maxSize);
    }

    public static String capture(Throwable throwable) {
        return capture(throwable, MAX_STACK_TRACE_SIZE);
    }
}
